package io.civicledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic byte layout hashed to seal a block.
 *
 * Layout (big-endian, version {@value #VERSION}):
 * <pre>
 *   version(1) || index(8) || timestamp(8) || payload || previousHash(32) || nonce(8)
 *
 *   payload = str reportId || str category || str urgency || str area || str address
 *          || str nearestStation || descriptionHash(32) || count(4) evidence(32 * n)
 *          || str identity || present(1) [str citizenId] || timestamp(8)
 *          || count(4) str authority * n || str status
 *   str = len(4) || utf8 bytes
 * </pre>
 * Independent of the JSON used for persistence; any change here must bump {@link #VERSION}.
 */
public final class SealEncoding {
    public static final byte VERSION = 1;

    private SealEncoding() {}

    public static byte[] encode(long index, long timestamp, BlockPayload data, Digest previousHash, long nonce) {
        byte[] payload = encodePayload(data);
        ByteBuffer buf = ByteBuffer.allocate(1 + 8 + 8 + payload.length + Digest.LENGTH + 8);
        buf.put(VERSION);
        buf.putLong(index);
        buf.putLong(timestamp);
        buf.put(payload);
        buf.put(previousHash.bytes());
        buf.putLong(nonce);
        return slice(buf);
    }

    public static byte[] encodePayload(BlockPayload p) {
        List<byte[]> strings = new ArrayList<>();
        strings.add(utf8(p.reportId()));
        strings.add(utf8(p.category()));
        strings.add(utf8(p.urgency().label()));
        strings.add(utf8(p.location().area()));
        strings.add(utf8(p.location().address()));
        strings.add(utf8(p.location().nearestStation()));
        byte[] identity = utf8(p.identity().label());
        byte[] citizen = p.citizenId().map(SealEncoding::utf8).orElse(null);
        List<byte[]> authorities = new ArrayList<>(p.authorityRouted().size());
        for (String a : p.authorityRouted()) authorities.add(utf8(a));
        byte[] status = utf8(p.status().name());

        int size = 0;
        for (byte[] s : strings) size += 4 + s.length;
        size += Digest.LENGTH;
        size += 4 + Digest.LENGTH * p.evidenceHashes().size();
        size += 4 + identity.length;
        size += 1 + (citizen == null ? 0 : 4 + citizen.length);
        size += 8;
        size += 4;
        for (byte[] a : authorities) size += 4 + a.length;
        size += 4 + status.length;

        ByteBuffer buf = ByteBuffer.allocate(size);
        for (byte[] s : strings) putBytes(buf, s);
        buf.put(p.descriptionHash().bytes());
        buf.putInt(p.evidenceHashes().size());
        for (Digest d : p.evidenceHashes()) buf.put(d.bytes());
        putBytes(buf, identity);
        if (citizen == null) {
            buf.put((byte) 0);
        } else {
            buf.put((byte) 1);
            putBytes(buf, citizen);
        }
        buf.putLong(p.timestamp());
        buf.putInt(authorities.size());
        for (byte[] a : authorities) putBytes(buf, a);
        putBytes(buf, status);
        return slice(buf);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer b, byte[] a) {
        b.putInt(a.length);
        b.put(a);
    }

    private static byte[] slice(ByteBuffer b) { b.flip(); byte[] out = new byte[b.remaining()]; b.get(out); return out; }
}
