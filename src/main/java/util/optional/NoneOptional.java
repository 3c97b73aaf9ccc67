package util.optional;

public class NoneOptional<T> extends Optional<T> {

    @Override
    public boolean isNone() {
        return true;
    }

    @Override
    public T get() {
        throw new RuntimeException("No value in None case");
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public boolean equals(Object that) {
        return that instanceof NoneOptional;
    }

    @Override
    public String toString() {
        return "None";
    }
}
