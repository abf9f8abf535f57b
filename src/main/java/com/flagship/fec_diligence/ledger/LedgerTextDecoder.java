package com.flagship.fec_diligence.ledger;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes raw ledger bytes. FEC exports come out of French accounting packages in
 * UTF-8 (often with a BOM), Windows-1252 or ISO-8859-1; the first charset that decodes
 * the bytes without a malformed sequence wins.
 */
@Slf4j
final class LedgerTextDecoder {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private static final List<Charset> CANDIDATES = List.of(
        StandardCharsets.UTF_8,
        Charset.forName("windows-1252"),
        StandardCharsets.ISO_8859_1
    );

    private LedgerTextDecoder() {
    }

    static String decode(byte[] content) {
        int offset = hasUtf8Bom(content) ? UTF8_BOM.length : 0;
        for (Charset charset : CANDIDATES) {
            CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            try {
                String text = decoder.decode(ByteBuffer.wrap(content, offset, content.length - offset)).toString();
                log.debug("Ledger content decoded as {}", charset.name());
                return text;
            } catch (CharacterCodingException e) {
                log.debug("Ledger content is not valid {}", charset.name());
            }
        }
        // ISO-8859-1 maps every byte, so this is only reached for an unusual JVM charset table
        return new String(content, offset, content.length - offset, StandardCharsets.ISO_8859_1);
    }

    private static boolean hasUtf8Bom(byte[] content) {
        return content.length >= UTF8_BOM.length
            && content[0] == UTF8_BOM[0]
            && content[1] == UTF8_BOM[1]
            && content[2] == UTF8_BOM[2];
    }
}
