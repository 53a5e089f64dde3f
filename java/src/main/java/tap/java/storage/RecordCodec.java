package tap.java.storage;

import tap.core.model.Identity;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for journal records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x7A90
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (little-endian)]
 *     - lsn:         int64
 *     - identity:    int32 len + UTF-8 bytes of {@link Identity#key()}
 *     - tombstone:   byte (0 or 1)
 *     - windowStart: int64
 *     - windowNanos: int64
 *     - committed:   int64
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x7A90;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Encode a record into header+payload bytes ready for append. */
    static byte[] encode(QuotaRecord record) {
        byte[] payload = encodePayload(record);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static QuotaRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long lsn = b.getLong();
        Identity identity = Identity.parse(readString(b));
        boolean tombstone = b.get() != 0;
        long windowStart = b.getLong();
        long windowNanos = b.getLong();
        long committed = b.getLong();
        return new QuotaRecord(identity, windowStart, windowNanos, committed, tombstone, lsn);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] encodePayload(QuotaRecord record) {
        byte[] key = record.identity().key().getBytes(StandardCharsets.UTF_8);
        int size = 8 + 4 + key.length + 1 + 8 + 8 + 8;

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(record.lsn());
        b.putInt(key.length).put(key);
        b.put((byte) (record.tombstone() ? 1 : 0));
        b.putLong(record.windowStartNanos());
        b.putLong(record.windowNanos());
        b.putLong(record.committed());
        return b.array();
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("bad string length " + len);
        }
        byte[] s = new byte[len];
        b.get(s);
        return new String(s, StandardCharsets.UTF_8);
    }
}
