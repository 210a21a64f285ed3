package reia.lower;

import java.util.Objects;

public record LoweringOptions(
        RuntimeTargets runtime,
        LiteralEncoding encoding,
        boolean parallel
) {
    public LoweringOptions {
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(encoding, "encoding");
    }

    public static LoweringOptions defaults() {
        return new LoweringOptions(RuntimeTargets.reia(), LiteralEncoding.CANONICAL, false);
    }

    public LoweringOptions withRuntime(RuntimeTargets runtime) {
        return new LoweringOptions(runtime, encoding, parallel);
    }

    public LoweringOptions withEncoding(LiteralEncoding encoding) {
        return new LoweringOptions(runtime, encoding, parallel);
    }

    public LoweringOptions withParallel(boolean parallel) {
        return new LoweringOptions(runtime, encoding, parallel);
    }
}
