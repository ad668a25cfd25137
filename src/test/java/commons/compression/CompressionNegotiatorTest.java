package commons.compression;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CompressionNegotiatorTest {

    @Test
    public void testFirstSupportedCodecWins() {
        CompressionNegotiator negotiator = new CompressionNegotiator(
                List.of(CompressionType.ZSTD, CompressionType.LZ4, CompressionType.GZIP));

        assertEquals(CompressionType.ZSTD, negotiator.select((short) 7));
        assertEquals(CompressionType.LZ4, negotiator.select((short) 6));
        assertEquals(CompressionType.LZ4, negotiator.select((short) 3));
    }

    @Test
    public void testNothingSupportedFallsBackToNone() {
        CompressionNegotiator negotiator = new CompressionNegotiator(List.of(CompressionType.ZSTD));

        assertEquals(CompressionType.NONE, negotiator.select((short) 5));
        assertNull(negotiator.compressorFor((short) 5));
    }

    @Test
    public void testEmptyPreferenceMeansNone() {
        assertEquals(List.of(CompressionType.NONE), new CompressionNegotiator(Collections.emptyList()).getPreference());
        assertEquals(List.of(CompressionType.NONE), new CompressionNegotiator(null).getPreference());
        assertNull(CompressionNegotiator.none().compressorFor((short) 7));
    }

    @Test
    public void testNoneFirstDisablesCompression() {
        CompressionNegotiator negotiator = new CompressionNegotiator(List.of(CompressionType.NONE, CompressionType.GZIP));
        assertNull(negotiator.compressorFor((short) 7));
    }

    @Test
    public void testPoolIsSharedAcrossRequests() {
        CompressionNegotiator negotiator = new CompressionNegotiator(List.of(CompressionType.SNAPPY));

        CompressorPool first = negotiator.compressorFor((short) 3);
        CompressorPool second = negotiator.compressorFor((short) 7);

        assertNotNull(first);
        assertSame(first, second);
        assertEquals(CompressionType.SNAPPY, first.getCodec());
    }

    @Test
    public void testCustomCodecAccepted() {
        CompressionCodec custom = new CompressorPoolTest.FailingCodec();
        CompressionNegotiator negotiator = new CompressionNegotiator(List.of(custom));

        assertSame(custom, negotiator.select((short) 3));
        assertSame(custom, negotiator.compressorFor((short) 3).getCodec());
    }
}
