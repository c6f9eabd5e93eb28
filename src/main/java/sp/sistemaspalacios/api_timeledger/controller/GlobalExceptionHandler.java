package sp.sistemaspalacios.api_timeledger.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import sp.sistemaspalacios.api_timeledger.exception.ResourceNotFoundException;

import java.util.Map;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseBody
    public ResponseEntity<Map<String, String>> handleNotFound(ResourceNotFoundException e) {
        log.warn("Recurso no encontrado: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(e));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseBody
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Solicitud inválida: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    @ResponseBody
    public ResponseEntity<Map<String, String>> handleBadParameter(Exception e) {
        log.warn("Parámetro inválido: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e));
    }

    private Map<String, String> errorBody(Exception e) {
        return Map.of("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
