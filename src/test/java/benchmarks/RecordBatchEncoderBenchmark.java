package benchmarks;

import commons.compression.CompressionNegotiator;
import commons.compression.CompressionType;
import commons.compression.CompressorPool;
import org.openjdk.jmh.annotations.*;
import producer.ProducerRecord;
import producer.RecordBatch;
import producer.RecordBatchEncoder;

import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
public class RecordBatchEncoderBenchmark {
    @Param({"none", "gzip", "snappy", "lz4", "zstd"})
    String codec;

    RecordBatchEncoder encoder;
    CompressorPool compressor;
    RecordBatch batch;

    private String randStringGen() {
        String chars = "ABCDEFGHIJKLMNOPQRSTUVWXYZ1234567890";
        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < 50; i++) {
            sb.append(chars.charAt((int) (Math.random() * chars.length())));
        }
        return sb.toString();
    }

    @Setup(Level.Trial)
    public void setup() {
        encoder = new RecordBatchEncoder();
        compressor = new CompressionNegotiator(List.of(CompressionType.fromName(codec))).compressorFor((short) 7);

        batch = new RecordBatch("topic", 0);
        for (int i = 0; i < 1_000; i++) {
            batch.tryAppend(ProducerRecord.of("topic", "key" + (i % 100), randStringGen()));
        }
        batch.seal();
    }

    /**
     * One 1,000 record batch per op.
     */
    @Benchmark
    public byte[] encodeBatch() {
        return encoder.encode(batch, compressor);
    }
}
