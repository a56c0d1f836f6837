package simboard.core;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String s) {
        super(s);
    }

    public NotFoundException(String type, long id) {
        this(type + " " + id);
    }

    public NotFoundException(String type, String name) {
        this(type + " '" + name + "' not found");
    }

    public static <T> T check(T object, String type, long id) {
        if (object == null) {
            throw new NotFoundException(type, id);
        }
        return object;
    }

    public static <T> T check(T object, String type, String name) {
        if (object == null) {
            throw new NotFoundException(type, name);
        }
        return object;
    }
}
