package com.example.hostbackup.tools;

import com.example.hostbackup.util.Formats;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Checagem estrutural de arquivos tar(.gz) sem extrair nada: magic do gzip, cabeçalho tar com checksum
 * válido. Também gera uma prévia do conteúdo a partir dos cabeçalhos.
 */
public final class ArchiveInspector {

    private static final int BLOCK = 512;
    private static final int SAMPLE_LIMIT = 50;
    private static final Pattern CPMOVE = Pattern.compile("cpmove-([a-z0-9_]+)");

    private ArchiveInspector() {}

    public static Verification verify(Path archive) {
        if (archive == null || !Files.isRegularFile(archive)) {
            return Verification.invalid("File not found");
        }
        try {
            if (Files.size(archive) == 0) {
                return Verification.invalid("File is empty");
            }
            try (InputStream in = open(archive)) {
                byte[] header = in.readNBytes(BLOCK);
                if (header.length < BLOCK) {
                    return Verification.invalid("Archive is truncated");
                }
                if (isZeroBlock(header)) {
                    return Verification.invalid("Archive contains no entries");
                }
                if (!checksumMatches(header)) {
                    return Verification.invalid("Not a valid tar archive");
                }
            }
            return Verification.ok();
        } catch (IOException e) {
            return Verification.invalid("Not a valid gzip archive: " + e.getMessage());
        }
    }

    /**
     * Lista os cabeçalhos e marca os tipos de conteúdo encontrados.
     */
    public static Preview preview(Path archive) throws IOException {
        Preview preview = new Preview();
        preview.size = Files.size(archive);
        try (InputStream in = open(archive)) {
            String pendingLongName = null;
            while (true) {
                byte[] header = in.readNBytes(BLOCK);
                if (header.length < BLOCK || isZeroBlock(header)) {
                    break;
                }
                if (!checksumMatches(header)) {
                    throw new IOException("Cabeçalho tar inválido após " + preview.totalFiles + " entradas");
                }
                long size = parseOctal(header, 124, 12);
                long padded = ((size + BLOCK - 1) / BLOCK) * BLOCK;
                char type = (char) header[156];
                if (type == 'L') {
                    byte[] data = in.readNBytes((int) Math.min(padded, Integer.MAX_VALUE));
                    pendingLongName = cString(data, 0, (int) Math.min(size, data.length));
                    continue;
                }
                String name = pendingLongName != null ? pendingLongName : entryName(header);
                pendingLongName = null;
                preview.record(name);
                skipFully(in, padded);
            }
        }
        return preview;
    }

    private static InputStream open(Path archive) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
        raw.mark(2);
        int b1 = raw.read();
        int b2 = raw.read();
        raw.reset();
        if (b1 == 0x1f && b2 == 0x8b) {
            return new GZIPInputStream(raw, 64 * 1024);
        }
        if (archive.getFileName().toString().endsWith(".tar")) {
            return raw;
        }
        raw.close();
        throw new IOException("missing gzip magic");
    }

    private static boolean isZeroBlock(byte[] block) {
        for (byte b : block) {
            if (b != 0) return false;
        }
        return true;
    }

    static boolean checksumMatches(byte[] header) {
        long stored = parseOctal(header, 148, 8);
        long computed = 0;
        for (int i = 0; i < BLOCK; i++) {
            computed += (i >= 148 && i < 156) ? ' ' : (header[i] & 0xff);
        }
        return stored == computed;
    }

    private static long parseOctal(byte[] buf, int offset, int length) {
        long value = 0;
        int end = offset + length;
        int i = offset;
        while (i < end && (buf[i] == ' ' || buf[i] == 0)) i++;
        for (; i < end; i++) {
            byte b = buf[i];
            if (b < '0' || b > '7') break;
            value = (value << 3) + (b - '0');
        }
        return value;
    }

    private static String entryName(byte[] header) {
        String name = cString(header, 0, 100);
        String magic = cString(header, 257, 6);
        if (magic.startsWith("ustar")) {
            String prefix = cString(header, 345, 155);
            if (!prefix.isEmpty()) {
                return prefix + "/" + name;
            }
        }
        return name;
    }

    private static String cString(byte[] buf, int offset, int length) {
        int end = offset;
        int max = Math.min(buf.length, offset + length);
        while (end < max && buf[end] != 0) end++;
        return new String(buf, offset, end - offset, StandardCharsets.UTF_8);
    }

    private static void skipFully(InputStream in, long bytes) throws IOException {
        long remaining = bytes;
        while (remaining > 0) {
            long skipped = in.skip(remaining);
            if (skipped <= 0) {
                if (in.read() < 0) {
                    throw new IOException("Arquivo tar truncado");
                }
                skipped = 1;
            }
            remaining -= skipped;
        }
    }

    public static final class Verification {
        private final boolean valid;
        private final String message;

        private Verification(boolean valid, String message) {
            this.valid = valid;
            this.message = message;
        }

        static Verification ok() { return new Verification(true, "Valid archive"); }
        static Verification invalid(String message) { return new Verification(false, message); }

        public boolean valid() { return valid; }
        public String message() { return message; }
    }

    /** Resumo do conteúdo de um arquivo de conta. */
    public static final class Preview {
        private int totalFiles;
        private final List<String> sampleFiles = new ArrayList<>();
        private boolean hasHomedir;
        private boolean hasMysql;
        private boolean hasPgsql;
        private boolean hasEmail;
        private boolean hasSsl;
        private boolean hasDnsZones;
        private String account;
        private long size;

        private void record(String name) {
            totalFiles++;
            if (sampleFiles.size() < SAMPLE_LIMIT) sampleFiles.add(name);
            Matcher m = CPMOVE.matcher(name);
            if (m.find()) account = m.group(1);
            if (name.contains("homedir")) hasHomedir = true;
            if (name.contains("mysql")) hasMysql = true;
            if (name.contains("pgsql") || name.contains("postgres")) hasPgsql = true;
            if (name.contains("mail") || name.contains("/et/")) hasEmail = true;
            if (name.contains("ssl")) hasSsl = true;
            if (name.contains("dnszones")) hasDnsZones = true;
        }

        public int totalFiles() { return totalFiles; }
        public List<String> sampleFiles() { return List.copyOf(sampleFiles); }
        public boolean hasHomedir() { return hasHomedir; }
        public boolean hasMysql() { return hasMysql; }
        public boolean hasPgsql() { return hasPgsql; }
        public boolean hasEmail() { return hasEmail; }
        public boolean hasSsl() { return hasSsl; }
        public boolean hasDnsZones() { return hasDnsZones; }
        public String account() { return account; }
        public long size() { return size; }
        public String sizeFormatted() { return Formats.size(size); }
    }
}
