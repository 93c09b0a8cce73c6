package pt.raidline.eventual.lambdas;

@FunctionalInterface
public interface Throwing<V> {
    V get() throws Exception;
}
