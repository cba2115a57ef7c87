package com.qrorder.payment.service;

import com.qrorder.common.exception.BusinessException;
import com.qrorder.common.exception.ErrorCode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Payment transaction ids: {@code SO-<sessionCode>-<epochMillis>}.
 * Session codes contain dashes themselves, so parsing anchors on the trailing millis.
 */
public final class TransactionIds {

    private static final Pattern FORMAT = Pattern.compile("^SO-(.+)-\\d+$");

    private TransactionIds() {
    }

    public static String create(String sessionCode, long epochMillis) {
        return "SO-" + sessionCode + "-" + epochMillis;
    }

    public static String sessionCodeOf(String transactionId) {
        if (transactionId == null) {
            throw new BusinessException(ErrorCode.MALFORMED_CALLBACK, "Missing transaction id");
        }
        Matcher matcher = FORMAT.matcher(transactionId);
        if (!matcher.matches()) {
            throw new BusinessException(ErrorCode.MALFORMED_CALLBACK,
                    "Unrecognized transaction id: " + transactionId);
        }
        return matcher.group(1);
    }
}
