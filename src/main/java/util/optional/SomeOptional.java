package util.optional;

public class SomeOptional<T> extends Optional<T> {

    private final T t;

    SomeOptional(T t) {
        this.t = t;
    }

    @Override
    public boolean isNone() {
        return false;
    }

    @Override
    public T get() {
        return t;
    }

    @Override
    public int hashCode() {
        return t.hashCode();
    }

    @Override
    public boolean equals(Object that) {
        if (!(that instanceof SomeOptional)) {
            return false;
        }
        return t.equals(((SomeOptional<?>) that).t);
    }

    @Override
    public String toString() {
        return "Some(" + t + ")";
    }
}
