package fr.imt.distroforge.distroforge.presentation.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope of error responses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HttpResponse<T> {

    private boolean success;
    private String errorCode;
    private String message;
    private List<String> details;
    private T data;

    public static <T> HttpResponse<T> error(String message) {
        return new HttpResponse<>(false, null, message, null, null);
    }

    public static <T> HttpResponse<T> error(String errorCode, String message) {
        return new HttpResponse<>(false, errorCode, message, null, null);
    }

    public static <T> HttpResponse<T> error(String errorCode, String message, List<String> details) {
        return new HttpResponse<>(false, errorCode, message, details, null);
    }
}
