package org.waabox.presetcat.mutation;

import java.nio.file.Path;

/**
 * What was found, and possibly created, for a manufacturer and device.
 *
 * @param manufacturerExists whether the manufacturer directory exists
 * @param deviceExists       whether the device directory exists
 * @param jsonExists         whether the device directory holds a document
 * @param jsonPath           the device document, null when there is none
 * @param created            whether anything was created by this call
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DirectoryStructure(
    boolean manufacturerExists,
    boolean deviceExists,
    boolean jsonExists,
    Path jsonPath,
    boolean created
) {
}
