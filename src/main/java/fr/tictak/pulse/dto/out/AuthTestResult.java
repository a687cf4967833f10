package fr.tictak.pulse.dto.out;

public record AuthTestResult(boolean success, String message) {

    public static AuthTestResult ok(String message) {
        return new AuthTestResult(true, message);
    }

    public static AuthTestResult failed(String message) {
        return new AuthTestResult(false, message);
    }
}
