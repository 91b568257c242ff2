package io.courier.protocol;

import java.security.SecureRandom;

public final class RequestIds {
    public static final int MAX_LENGTH = 128;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RequestIds() {
    }

    public static String newRequestId() {
        return randomHex(16); // 16 bytes => 32 hex chars
    }

    public static boolean isWellFormed(String requestId) {
        if (requestId == null || requestId.isBlank() || requestId.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < requestId.length(); i++) {
            if (Character.isISOControl(requestId.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String randomHex(int bytes) {
        byte[] value = new byte[bytes];
        RANDOM.nextBytes(value);
        StringBuilder sb = new StringBuilder(bytes * 2);
        for (byte b : value) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
