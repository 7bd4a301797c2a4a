package fr.imt.chronos.chronos.presentation.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for error responses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HttpResponse<T> {

    private boolean success;
    private String error;
    private String message;
    private T data;

    public static <T> HttpResponse<T> error(String error) {
        return new HttpResponse<>(false, error, null, null);
    }

    public static <T> HttpResponse<T> error(String error, String message) {
        return new HttpResponse<>(false, error, message, null);
    }
}
