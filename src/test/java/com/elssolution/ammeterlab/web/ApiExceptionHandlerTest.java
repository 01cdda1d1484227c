package com.elssolution.ammeterlab.web;

import com.elssolution.ammeterlab.exception.ArchiveException;
import com.elssolution.ammeterlab.exception.ConfigException;
import com.elssolution.ammeterlab.exception.DeviceTimeoutException;
import com.elssolution.ammeterlab.exception.ErrorKind;
import com.elssolution.ammeterlab.exception.RunNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ApiExceptionHandlerTest {

    private ApiExceptionHandler handler;
    private HttpServletRequest req;

    @BeforeEach
    void setUp() {
        handler = new ApiExceptionHandler();
        req = mock(HttpServletRequest.class);
        when(req.getRequestURI()).thenReturn("/runs/x");
    }

    @Test
    void maps_not_found_to_404() {
        ResponseEntity<ApiExceptionHandler.ErrorResponse> r = handler.onLabException(new RunNotFoundException("x"), req);

        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(r.getBody().code()).isEqualTo("NOT_FOUND");
        assertThat(r.getBody().message()).contains("x");
        assertThat(r.getBody().path()).isEqualTo("/runs/x");
    }

    @Test
    void maps_config_to_400_and_archive_to_503() {
        assertThat(handler.onLabException(new ConfigException("bad"), req).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.onLabException(new ArchiveException("io"), req).getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void device_failures_are_bad_gateway() {
        assertThat(handler.onLabException(new DeviceTimeoutException("slow"), req).getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.PROTOCOL)).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ApiExceptionHandler.statusFor(ErrorKind.INCOMPATIBLE)).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void illegal_argument_is_bad_request() {
        ResponseEntity<ApiExceptionHandler.ErrorResponse> r = handler.onBadRequest(new IllegalArgumentException("no such device"), req);
        assertThat(r.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(r.getBody().code()).isEqualTo("CONFIG");
    }
}
