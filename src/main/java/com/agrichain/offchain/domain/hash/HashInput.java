package com.agrichain.offchain.domain.hash;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;


/**
 * Builder for canonical hash input.  Field order is the order of the
 * {@code add} calls and is part of the digest: reordering changes it.
 * Values are added already formatted (see {@link AnchorFieldFormat}).
 */
public final class HashInput {

    public static final char DELIMITER = '-';

    private final HashInputEncoding encoding;
    private final List<String> fields = new ArrayList<>();

    private HashInput(HashInputEncoding encoding) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    public static HashInput of(HashInputEncoding encoding) {
        return new HashInput(encoding);
    }

    public static HashInput delimited() {
        return new HashInput(HashInputEncoding.DELIMITED);
    }

    public HashInput add(String field) {
        fields.add(Objects.requireNonNull(field, "field"));
        return this;
    }

    public HashInput add(double value) {
        return add(AnchorFieldFormat.decimal(value));
    }

    public byte[] toBytes() {
        if (encoding == HashInputEncoding.DELIMITED) {
            return String.join(String.valueOf(DELIMITER), fields).getBytes(StandardCharsets.UTF_8);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String f : fields) {
            byte[] utf8 = f.getBytes(StandardCharsets.UTF_8);
            out.writeBytes(ByteBuffer.allocate(4).putInt(utf8.length).array());
            out.writeBytes(utf8);
        }
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return encoding + fields.toString();
    }
}
