package com.flagship.fec_diligence.analysis;

import lombok.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Raw content of one ledger file, as handed to the analysis.
 */
@Value
public class LedgerSource {
    String filename;
    byte[] content;

    public static LedgerSource of(Path path) throws IOException {
        return new LedgerSource(path.getFileName().toString(), Files.readAllBytes(path));
    }
}
