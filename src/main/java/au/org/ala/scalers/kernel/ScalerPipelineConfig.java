package au.org.ala.scalers.kernel;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.concurrent.ExecutorService;

/**
 * Execution settings for a {@link ScalerPipeline}. Without an executor every kernel runs on the calling thread.
 */
public class ScalerPipelineConfig {

    public static final long DEFAULT_PARALLEL_PIXEL_THRESHOLD = 1_000_000L;
    public static final int DEFAULT_MIN_ROWS_PER_BAND = 8;

    private ExecutorService _executor;
    private long _parallelPixelThreshold = DEFAULT_PARALLEL_PIXEL_THRESHOLD;
    private int _minRowsPerBand = DEFAULT_MIN_ROWS_PER_BAND;
    private OutOfBoundsMode _horizontalMode = OutOfBoundsMode.CLAMP;
    private OutOfBoundsMode _verticalMode = OutOfBoundsMode.CLAMP;

    public ScalerPipelineConfig() {
    }

    public ScalerPipelineConfig(ExecutorService executor) {
        _executor = executor;
    }

    public ScalerPipelineConfig(ExecutorService executor, long parallelPixelThreshold, int minRowsPerBand) {
        _executor = executor;
        setParallelPixelThreshold(parallelPixelThreshold);
        setMinRowsPerBand(minRowsPerBand);
    }

    public ExecutorService getExecutor() { return _executor; }
    public void setExecutor(ExecutorService executor) { _executor = executor; }

    public long getParallelPixelThreshold() {
        return _parallelPixelThreshold;
    }
    public void setParallelPixelThreshold(long threshold) {
        Preconditions.checkArgument(threshold >= 0, "threshold must not be negative: %s", threshold);
        _parallelPixelThreshold = threshold;
    }

    public int getMinRowsPerBand() {
        return _minRowsPerBand;
    }
    public void setMinRowsPerBand(int rows) {
        Preconditions.checkArgument(rows > 0, "rows per band must be positive: %s", rows);
        _minRowsPerBand = rows;
    }

    public OutOfBoundsMode getHorizontalMode() { return _horizontalMode; }
    public void setHorizontalMode(OutOfBoundsMode mode) { _horizontalMode = Preconditions.checkNotNull(mode); }

    public OutOfBoundsMode getVerticalMode() { return _verticalMode; }
    public void setVerticalMode(OutOfBoundsMode mode) { _verticalMode = Preconditions.checkNotNull(mode); }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("executor", _executor)
                .add("parallelPixelThreshold", _parallelPixelThreshold)
                .add("minRowsPerBand", _minRowsPerBand)
                .add("horizontalMode", _horizontalMode)
                .add("verticalMode", _verticalMode)
                .toString();
    }
}
