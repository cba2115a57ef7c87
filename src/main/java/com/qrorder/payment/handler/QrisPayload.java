package com.qrorder.payment.handler;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * EMVCo merchant-presented QR payload in the QRIS profile: tag-length-value
 * fields terminated by a CRC-16/CCITT-FALSE checksum (tag 63).
 */
final class QrisPayload {

    private static final String QRIS_GLOBAL_ID = "ID.CO.QRIS.WWW";
    private static final int MAX_MERCHANT_NAME = 25;
    private static final int MAX_MERCHANT_CITY = 15;
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_PRINTABLE_ASCII = Pattern.compile("[^\\x20-\\x7E]");

    private QrisPayload() {
    }

    static String build(String transactionId, BigDecimal amount, String merchantName, String merchantCity) {
        StringBuilder payload = new StringBuilder()
                .append(field("00", "01"))
                .append(field("01", "12"))   // dynamic, single use
                .append(field("26", field("00", QRIS_GLOBAL_ID) + field("02", "ID10" + lastDigits(transactionId))))
                .append(field("52", "5399"))
                .append(field("53", "360"))  // IDR
                .append(field("54", amount.toPlainString()))
                .append(field("58", "ID"))
                .append(field("59", truncate(merchantName, MAX_MERCHANT_NAME)))
                .append(field("60", truncate(merchantCity, MAX_MERCHANT_CITY)))
                .append("6304");
        return payload.append(String.format("%04X", crc16(payload.toString()))).toString();
    }

    static String field(String tag, String value) {
        return tag + String.format("%02d", value.length()) + value;
    }

    static int crc16(String data) {
        int crc = 0xFFFF;
        for (byte b : data.getBytes(StandardCharsets.US_ASCII)) {
            crc ^= (b & 0xFF) << 8;
            for (int i = 0; i < 8; i++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
            }
        }
        return crc & 0xFFFF;
    }

    private static String lastDigits(String transactionId) {
        return transactionId.length() <= 10 ? transactionId : transactionId.substring(transactionId.length() - 10);
    }

    // lengths are counted in chars and the CRC runs over ASCII bytes, so both must agree
    private static String truncate(String value, int max) {
        String ascii = value == null ? "" : toAscii(value).trim();
        String safe = ascii.isEmpty() ? "MERCHANT" : ascii;
        return safe.length() <= max ? safe : safe.substring(0, max);
    }

    static String toAscii(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String unaccented = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return NON_PRINTABLE_ASCII.matcher(unaccented).replaceAll("");
    }
}
