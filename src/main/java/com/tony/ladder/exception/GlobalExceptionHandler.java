package com.tony.ladder.exception;

import com.tony.ladder.model.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Réponses d'erreur homogènes pour toute l'API.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiError("NOT_FOUND", e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(InvalidMatchException.class)
    public ResponseEntity<ApiError> handleInvalidMatch(InvalidMatchException e, HttpServletRequest request) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("INVALID_MATCH", e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + " : " + err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("VALIDATION_FAILED", message, request.getRequestURI()));
    }

    // Configuration des saisons ou ordre des matchs incohérents : à corriger côté données
    @ExceptionHandler({SeasonConfigurationException.class, MatchOrderingException.class})
    public ResponseEntity<ApiError> handleInconsistency(LadderException e, HttpServletRequest request) {
        log.error("⚠️ Données incohérentes sur {} : {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiError("INCONSISTENT_DATA", e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(ReplayFailedException.class)
    public ResponseEntity<ApiError> handleReplayFailed(ReplayFailedException e, HttpServletRequest request) {
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("REPLAY_FAILED", e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneral(Exception e, HttpServletRequest request) {
        log.error("❌ Erreur inattendue sur {} : {}", request.getRequestURI(), e.getMessage(), e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("INTERNAL_ERROR", "Erreur technique inattendue", request.getRequestURI()));
    }
}
