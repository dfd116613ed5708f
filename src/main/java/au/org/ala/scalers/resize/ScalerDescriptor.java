package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerCategory;
import au.org.ala.scalers.ScalerInfo;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Describes one scaling algorithm: who wrote it, what it can do and how to build it.
 * <p>
 * The static members every concrete scaler class publishes are reachable through its descriptor, so callers can
 * query and construct algorithms they only know by name.
 *
 * @param <T> the scaler class
 */
public abstract class ScalerDescriptor<T extends ScalerInfo> {

    private final Class<T> type;
    private final String name;
    private final String author;
    private final int year;
    private final String url;
    private final String description;
    private final Function<ScaleFactor, T> factory;
    private final BiFunction<T, ScalerPipeline, ScalerDispatch> dispatcher;

    ScalerDescriptor(Class<T> type, String name, String author, int year, String url, String description,
                     Function<ScaleFactor, T> factory, BiFunction<T, ScalerPipeline, ScalerDispatch> dispatcher) {
        this.type = Preconditions.checkNotNull(type, "type");
        this.name = Preconditions.checkNotNull(name, "name");
        this.author = author;
        this.year = year;
        this.url = url;
        this.description = description;
        this.factory = Preconditions.checkNotNull(factory, "factory");
        this.dispatcher = Preconditions.checkNotNull(dispatcher, "dispatcher");
    }

    public Class<T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the algorithm's author, or {@code null} for textbook algorithms
     */
    public String getAuthor() {
        return author;
    }

    /**
     * @return year of publication, or 0 when unknown
     */
    public int getYear() {
        return year;
    }

    public String getUrl() {
        return url;
    }

    public String getDescription() {
        return description;
    }

    public abstract ScalerCategory getCategory();

    public abstract ScaleFactor getDefaultScale();

    public abstract boolean supports(ScaleFactor scale);

    /**
     * Finds the smallest output this algorithm can produce from a {@code sourceWidth x sourceHeight} image that is
     * at least {@code targetWidth x targetHeight}.
     */
    public abstract Optional<Dimension> smallestTargetCovering(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight);

    /**
     * Builds the scaler that turns a {@code sourceWidth x sourceHeight} image into {@code target}.
     *
     * @throws au.org.ala.scalers.UnsupportedScaleException if {@code target} is not reachable
     */
    public abstract T createForTarget(int sourceWidth, int sourceHeight, Dimension target);

    /**
     * @throws au.org.ala.scalers.UnsupportedScaleException if the scale is not supported
     */
    public T create(ScaleFactor scale) {
        return factory.apply(scale);
    }

    public T createDefault() {
        return create(getDefaultScale());
    }

    ScalerDispatch dispatch(ScalerInfo scaler, ScalerPipeline pipeline) {
        return dispatcher.apply(type.cast(scaler), pipeline);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("type", type.getSimpleName())
                .add("category", getCategory())
                .toString();
    }
}
