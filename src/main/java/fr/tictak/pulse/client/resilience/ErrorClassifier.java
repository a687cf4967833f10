package fr.tictak.pulse.client.resilience;

import fr.tictak.pulse.client.ErrorKind;
import fr.tictak.pulse.client.PulseClientException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public class ErrorClassifier {

    public ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof PulseClientException pulse) {
            return pulse.getKind();
        }
        if (cause instanceof HttpStatusCodeException http) {
            return ofStatus(http.getStatusCode().value());
        }
        if (cause instanceof CancellationException) {
            return ErrorKind.FATAL;
        }
        if (cause instanceof ResourceAccessException
                || cause instanceof ConnectException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException
                || cause instanceof IOException) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.FATAL;
    }

    public boolean isTransient(Throwable error) {
        return classify(error) == ErrorKind.TRANSIENT;
    }

    public static ErrorKind ofStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.AUTH;
        }
        if (status == 400 || status == 422) {
            return ErrorKind.VALIDATION;
        }
        if (status == 404) {
            return ErrorKind.NOT_FOUND;
        }
        if (status == 408 || status == 429 || status >= 500) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.FATAL;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
