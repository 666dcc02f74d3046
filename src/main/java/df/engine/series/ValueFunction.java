package df.engine.series;

import df.engine.storage.Value;

/**
 * Elementwise mapping used by {@link Series#lambda}. The result may be a Value or any plain
 * Java object accepted by {@link Value#from(Object)}.
 */
@FunctionalInterface
public interface ValueFunction {
    Object apply(Value value, int index);
}
