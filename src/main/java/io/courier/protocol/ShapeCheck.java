package io.courier.protocol;

public record ShapeCheck(
        boolean ok,
        ShapeViolation violation
) {
    private static final ShapeCheck PASSED = new ShapeCheck(true, null);

    public static ShapeCheck passed() {
        return PASSED;
    }

    public static ShapeCheck rejected(ShapeViolation violation) {
        return new ShapeCheck(false, violation);
    }
}
