package com.scholary.transcriber.api;

import com.scholary.transcriber.capability.ModelLoadException;
import com.scholary.transcriber.capability.TranslationException;
import com.scholary.transcriber.error.ErrorKind;
import com.scholary.transcriber.error.TranscriberException;
import com.scholary.transcriber.error.ValidationException;
import com.scholary.transcriber.job.InvalidStateException;
import com.scholary.transcriber.job.JobNotFoundException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to HTTP responses with an {@link ErrorResponse} body.
 *
 * <p>Client mistakes are logged at warn without a stack trace. Unexpected errors are logged in
 * full and answered with a generic message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String UNEXPECTED_MESSAGE = "An unexpected error occurred";

  @ExceptionHandler(ValidationException.class)
  ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
    LOGGER.warn("Rejected request: {} ({})", ex.getMessage(), ex.getDetails());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ErrorResponse(
                ex.getKind().code(),
                ex.getMessage(),
                ex.getDetails(),
                ex.getFilename(),
                ex.getExpectedFormats(),
                ex.getSuggestions(),
                Instant.now()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Rejected upload over the multipart limit: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ErrorResponse.of(
                ErrorKind.VALIDATION_ERROR.code(),
                "File too large",
                "The upload exceeds the maximum request size"));
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class
  })
  ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    LOGGER.warn("Malformed request: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ErrorResponse.of(
                ErrorKind.VALIDATION_ERROR.code(),
                "Invalid parameters",
                ex.getClass().getSimpleName()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ErrorResponse.of(ex.getKind().code(), ex.getMessage(), ex.getDetails()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ErrorResponse.of("NOT_FOUND", "No such endpoint", ex.getResourcePath()));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(ErrorResponse.of("METHOD_NOT_ALLOWED", ex.getMessage(), null));
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
        .body(ErrorResponse.of(ErrorKind.VALIDATION_ERROR.code(), ex.getMessage(), null));
  }

  @ExceptionHandler(InvalidStateException.class)
  ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateException ex) {
    LOGGER.info("Conflicting request: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(ErrorResponse.of(ex.getKind().code(), ex.getMessage(), ex.getDetails()));
  }

  @ExceptionHandler(ModelLoadException.class)
  ResponseEntity<ErrorResponse> handleModelLoad(ModelLoadException ex) {
    LOGGER.error("Capability unavailable: {} ({})", ex.getMessage(), ex.getKey());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of(ex.getKind().code(), ex.getMessage(), ex.getDetails()));
  }

  @ExceptionHandler(TranslationException.class)
  ResponseEntity<ErrorResponse> handleTranslation(TranslationException ex) {
    LOGGER.error("Translation failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ErrorResponse.of(ex.getKind().code(), ex.getMessage(), null));
  }

  @ExceptionHandler(TranscriberException.class)
  ResponseEntity<ErrorResponse> handleTranscriber(TranscriberException ex) {
    LOGGER.error("Request failed with {}", ex.getKind(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(ex.getKind().code(), ex.getMessage(), null));
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of(ErrorKind.INTERNAL_ERROR.code(), UNEXPECTED_MESSAGE, null));
  }
}
