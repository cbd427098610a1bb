package org.dxworks.rune;

import java.nio.file.Path;

public class RuneFileDetector {

    public static final String EXTENSION = ".rune";

    public static boolean isRuneFile(Path filePath) {
        Path fileName = filePath.getFileName();
        return fileName != null && fileName.toString().toLowerCase().endsWith(EXTENSION);
    }
}
