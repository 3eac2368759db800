package org.iceforge.olap.engine.window;

/**
 * Function parameters. Only the ones the chosen function reads are validated.
 *
 * @param size         frame size of moving functions, current row included
 * @param offset       distance of lag and lead
 * @param buckets      number of tiles for ntile
 * @param defaultValue lag/lead value when the offset leaves the partition
 */
public record WindowParams(Integer size, Integer offset, Integer buckets, Object defaultValue) {

    public static final WindowParams NONE = new WindowParams(null, null, null, null);

    public static WindowParams size(int size) {
        return new WindowParams(size, null, null, null);
    }

    public static WindowParams offset(int offset, Object defaultValue) {
        return new WindowParams(null, offset, null, defaultValue);
    }

    public static WindowParams buckets(int buckets) {
        return new WindowParams(null, null, buckets, null);
    }
}
