package au.org.ala.scalers.kernel;

import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Project;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A window of source rows decoded to working colors and projected to key colors.
 * <p>
 * The frame keeps at most {@link #getWindowRows()} decoded rows. {@link #slide} moves the window, decoding only rows that
 * are not already held, so a kernel run over a band of the output holds a few rows of the source rather than all
 * of it. Reads outside the image are mapped back in with the configured {@link OutOfBoundsMode}s; mirrored or
 * clamped rows share one decoded copy. A windowed frame belongs to one thread. A frame from
 * {@link #decode} holds every row and is read-only once returned.
 *
 * @param <W> working color
 * @param <K> key color
 */
public final class NeighborFrame<W, K> {

    private static final int NOT_LOADED = -1;

    private final PixelRaster<?> source;
    private final int width;
    private final int height;
    private final int windowRows;
    private final int capacity;
    private final OutOfBoundsMode horizontalMode;
    private final OutOfBoundsMode verticalMode;
    private final RowLoader<W, K> loader;

    private final List<List<W>> work;
    private final List<List<K>> keys;
    private final int[] rowOfSlot;
    private final int[] slotOfRow;

    private NeighborFrame(PixelRaster<?> source, int capacity, OutOfBoundsMode horizontalMode,
                          OutOfBoundsMode verticalMode, RowLoader<W, K> loader) {
        Preconditions.checkArgument(source.getWidth() > 0 && source.getHeight() > 0,
                "cannot read neighbours of an empty %sx%s image", source.getWidth(), source.getHeight());
        Preconditions.checkArgument(capacity > 0, "a frame must hold at least one row, not %s", capacity);
        this.source = source;
        this.width = source.getWidth();
        this.height = source.getHeight();
        this.windowRows = capacity;
        this.capacity = Math.min(capacity, height);
        this.horizontalMode = Preconditions.checkNotNull(horizontalMode, "horizontalMode");
        this.verticalMode = Preconditions.checkNotNull(verticalMode, "verticalMode");
        this.loader = loader;

        this.work = new ArrayList<>(this.capacity);
        this.keys = new ArrayList<>(this.capacity);
        for (int i = 0; i < this.capacity; i++) {
            work.add(new ArrayList<>(width));
            keys.add(new ArrayList<>(width));
        }
        this.rowOfSlot = new int[this.capacity];
        this.slotOfRow = new int[height];
        Arrays.fill(rowOfSlot, NOT_LOADED);
        Arrays.fill(slotOfRow, NOT_LOADED);
    }

    /**
     * Creates an empty frame able to hold {@code rows} decoded rows of {@code source}.
     */
    public static <W, K, P> NeighborFrame<W, K> window(PixelRaster<P> source, Decode<P, W> decoder, Project<W, K> projector,
                                                       OutOfBoundsMode horizontalMode, OutOfBoundsMode verticalMode, int rows) {
        Preconditions.checkNotNull(decoder, "decoder");
        Preconditions.checkNotNull(projector, "projector");
        int width = source.getWidth();
        RowLoader<W, K> loader = (y, workRow, keyRow) -> {
            for (int x = 0; x < width; x++) {
                W decoded = decoder.decode(source.get(x, y));
                workRow.add(decoded);
                keyRow.add(projector.project(decoded));
            }
        };
        return new NeighborFrame<>(source, rows, horizontalMode, verticalMode, loader);
    }

    /**
     * Decodes every row of {@code source} on the calling thread.
     */
    public static <W, K, P> NeighborFrame<W, K> decode(PixelRaster<P> source, Decode<P, W> decoder, Project<W, K> projector,
                                                       OutOfBoundsMode horizontalMode, OutOfBoundsMode verticalMode) {
        NeighborFrame<W, K> frame = window(source, decoder, projector, horizontalMode, verticalMode, source.getHeight());
        frame.slide(0, frame.height - 1);
        return frame;
    }

    /**
     * Makes rows {@code firstRow..lastRow} (inclusive, before out of bounds mapping) readable, evicting rows outside
     * that range to make room.
     *
     * @throws IllegalArgumentException if the range is longer than the frame can hold
     */
    public void slide(int firstRow, int lastRow) {
        Preconditions.checkArgument(lastRow >= firstRow && lastRow - firstRow < windowRows,
                "rows %s..%s do not fit a window of %s rows", firstRow, lastRow, windowRows);
        boolean[] needed = new boolean[capacity];
        for (int y = firstRow; y <= lastRow; y++) {
            int slot = slotOfRow[verticalMode.resolve(y, height)];
            if (slot != NOT_LOADED) {
                needed[slot] = true;
            }
        }
        int free = 0;
        for (int y = firstRow; y <= lastRow; y++) {
            int row = verticalMode.resolve(y, height);
            if (slotOfRow[row] != NOT_LOADED) {
                continue;
            }
            while (needed[free]) {
                free++;
            }
            load(row, free);
            needed[free] = true;
        }
    }

    private void load(int row, int slot) {
        if (rowOfSlot[slot] != NOT_LOADED) {
            slotOfRow[rowOfSlot[slot]] = NOT_LOADED;
        }
        List<W> workRow = work.get(slot);
        List<K> keyRow = keys.get(slot);
        workRow.clear();
        keyRow.clear();
        loader.load(row, workRow, keyRow);
        rowOfSlot[slot] = row;
        slotOfRow[row] = slot;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return the longest row range {@link #slide} accepts
     */
    public int getWindowRows() {
        return windowRows;
    }

    public PixelRaster<?> getSource() {
        return source;
    }

    /**
     * @throws IllegalStateException if row {@code y} is not in the current window
     */
    public W work(int x, int y) {
        return work.get(slot(y)).get(horizontalMode.resolve(x, width));
    }

    /**
     * @throws IllegalStateException if row {@code y} is not in the current window
     */
    public K key(int x, int y) {
        return keys.get(slot(y)).get(horizontalMode.resolve(x, width));
    }

    private int slot(int y) {
        int row = verticalMode.resolve(y, height);
        int slot = slotOfRow[row];
        if (slot == NOT_LOADED) {
            throw new IllegalStateException(String.format("row %d (source row %d) is outside the decoded window", y, row));
        }
        return slot;
    }

    @FunctionalInterface
    private interface RowLoader<W, K> {
        void load(int row, List<W> workRow, List<K> keyRow);
    }
}
