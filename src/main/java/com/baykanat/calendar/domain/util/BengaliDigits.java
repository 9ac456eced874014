package com.baykanat.calendar.domain.util;

/** Batı rakamlarını (0-9) Bengalce rakamlara (০-৯) çevirir; diğer karakterler aynen kalır. */
public final class BengaliDigits {

    private static final char BENGALI_ZERO = '০';

    private BengaliDigits() {
    }

    /** "12" → "১২", "5a" → "৫a". Ters yönde çeviri yapılmaz. */
    public static String fromWestern(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append((char) (BENGALI_ZERO + (c - '0')));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
