package commons.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A compression algorithm as seen by the batch encoder: a stream transformation plus the
 * attribute bits that identify it inside a record batch.
 *
 * {@link CompressionType} covers the codecs brokers understand. Other implementations can be
 * handed to a {@link CompressionNegotiator} without any change to the encoder.
 */
public interface CompressionCodec {

    String getName();

    /**
     * Bits OR-ed into the record batch attributes word when this codec's output is used.
     * Zero means "no compression".
     */
    short getAttributes();

    /**
     * Lowest produce request version whose brokers accept batches compressed with this codec.
     */
    short getMinProduceVersion();

    default boolean isSupportedBy(short produceVersion) {
        return produceVersion >= getMinProduceVersion();
    }

    /**
     * Wraps {@code out} so that bytes written to the result are compressed into {@code out}.
     * Closing the returned stream must flush all trailing codec output.
     */
    OutputStream wrap(OutputStream out) throws IOException;

    /**
     * Wraps {@code in} so that reading the result yields the decompressed bytes.
     */
    InputStream unwrap(InputStream in) throws IOException;
}
