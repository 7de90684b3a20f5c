package dao.whalevault.relay.util;

import org.bouncycastle.jcajce.provider.digest.SHA256;

import java.io.ByteArrayOutputStream;

/**
 * Little-endian packing and the Solana compact-u16 length prefix.
 */
public final class ByteUtil {
    private ByteUtil() {}

    public static byte[] u64le(long value) {
        byte[] out = new byte[8];
        for (int i = 0; i < 8; i++) {
            out[i] = (byte) (value >>> (8 * i));
        }
        return out;
    }

    public static byte[] u32le(long value) {
        byte[] out = new byte[4];
        for (int i = 0; i < 4; i++) {
            out[i] = (byte) (value >>> (8 * i));
        }
        return out;
    }

    public static long readU64le(byte[] data, int offset) {
        long v = 0;
        for (int i = 7; i >= 0; i--) {
            v = (v << 8) | (data[offset + i] & 0xFF);
        }
        return v;
    }

    public static void writeCompactU16(ByteArrayOutputStream out, int value) {
        int rem = value;
        while (true) {
            int elem = rem & 0x7F;
            rem >>>= 7;
            if (rem == 0) {
                out.write(elem);
                return;
            }
            out.write(elem | 0x80);
        }
    }

    /**
     * Decodes a compact-u16 at {@code offset}.
     *
     * @return {value, bytesConsumed}
     */
    public static int[] readCompactU16(byte[] data, int offset) {
        int value = 0;
        int size = 0;
        while (true) {
            int elem = data[offset + size] & 0xFF;
            value |= (elem & 0x7F) << (size * 7);
            size++;
            if ((elem & 0x80) == 0) {
                return new int[]{value, size};
            }
            if (size >= 3) {
                throw new IllegalArgumentException("compact-u16 longer than 3 bytes at offset " + offset);
            }
        }
    }

    public static byte[] sha256(byte[]... parts) {
        SHA256.Digest digest = new SHA256.Digest();
        for (byte[] p : parts) {
            digest.update(p);
        }
        return digest.digest();
    }

    public static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.writeBytes(p);
        }
        return out.toByteArray();
    }
}
