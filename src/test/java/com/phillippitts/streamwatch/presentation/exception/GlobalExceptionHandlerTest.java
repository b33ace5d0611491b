package com.phillippitts.streamwatch.presentation.exception;

import com.phillippitts.streamwatch.exception.ControlTimeoutException;
import com.phillippitts.streamwatch.exception.EngineUnavailableException;
import com.phillippitts.streamwatch.exception.InvalidEndpointException;
import com.phillippitts.streamwatch.exception.SessionStartException;
import com.phillippitts.streamwatch.presentation.exception.GlobalExceptionHandler.ApiError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidEndpointReturns400WithoutEchoingUrl() {
        InvalidEndpointException ex = new InvalidEndpointException("unsupported scheme http");

        ResponseEntity<ApiError> response = handler.handleInvalidEndpoint(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidEndpointException");
        assertThat(response.getBody().details()).isEqualTo("unsupported scheme http");
    }

    @Test
    void validationFailureListsEveryField() {
        BindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "settingsRequest");
        bindingResult.addError(new FieldError("settingsRequest", "video.fps", "must be less than or equal to 120"));
        bindingResult.addError(new FieldError("settingsRequest", "audio", "must not be null"));
        MethodArgumentNotValidException ex = mock(MethodArgumentNotValidException.class);
        when(ex.getBindingResult()).thenReturn(bindingResult);

        ResponseEntity<ApiError> response = handler.handleValidation(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("ValidationFailed");
        assertThat(response.getBody().details())
                .isEqualTo("video.fps: must be less than or equal to 120; audio: must not be null");
    }

    @Test
    void domainRejectionReturns400WithReason() {
        ResponseEntity<ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("Video bitrate must be positive, got: 0"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("BadRequest");
        assertThat(response.getBody().details()).contains("Video bitrate must be positive");
    }

    @Test
    void malformedBodyReturns400WithGenericDetails() {
        HttpMessageNotReadableException ex =
                new HttpMessageNotReadableException("JSON parse error", mock(HttpInputMessage.class));

        ResponseEntity<ApiError> response = handler.handleBadRequest(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("Malformed request body");
    }

    @Test
    void engineFailuresReturn503() {
        ResponseEntity<ApiError> missing = handler.handleEngineFailure(
                new EngineUnavailableException("/usr/bin/ffmpeg", new IOException("not found")));
        ResponseEntity<ApiError> rejected = handler.handleEngineFailure(
                new SessionStartException("Video encoder rejected settings", "prepareVideo"));

        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(missing.getBody().message()).isEqualTo("Streaming engine unavailable");
        assertThat(missing.getBody().details()).doesNotContain("/usr/bin/ffmpeg");
        assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(rejected.getBody().errorCode()).isEqualTo("SessionStartException");
    }

    @Test
    void controlTimeoutReturns503() {
        ResponseEntity<ApiError> response =
                handler.handleControlTimeout(new ControlTimeoutException("stop", Duration.ofSeconds(10)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("ControlTimeoutException");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        Instant beforeCall = Instant.now().minusSeconds(1);

        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("secret detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret detail");
        assertThat(response.getBody().timestamp()).isAfter(beforeCall);
    }
}
