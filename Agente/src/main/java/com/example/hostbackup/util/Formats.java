package com.example.hostbackup.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Formatação legível de tamanhos e durações usada em logs de job, mensagens e notificações.
 */
public final class Formats {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private Formats() {}

    /**
     * Base 1024, duas casas no máximo, sem zeros à direita ("1.5 MB", "0 B"). Negativos viram 0.
     */
    public static String size(long bytes) {
        double value = Math.max(bytes, 0);
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.scale() < 0) {
            rounded = rounded.setScale(0, RoundingMode.UNNECESSARY);
        }
        return rounded.toPlainString() + " " + UNITS[unit];
    }

    /**
     * "45s", "2m 30s", "1h", "1h 15m". A unidade final zerada é omitida.
     */
    public static String duration(double seconds) {
        long total = Math.max(0, Math.round(seconds));
        if (total < 60) {
            return total + "s";
        }
        if (total < 3600) {
            long minutes = total / 60;
            long secs = total % 60;
            return secs > 0 ? minutes + "m " + secs + "s" : minutes + "m";
        }
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        return minutes > 0 ? hours + "h " + minutes + "m" : hours + "h";
    }

    public static String duration(Duration elapsed) {
        return duration(elapsed.toMillis() / 1000.0);
    }
}
