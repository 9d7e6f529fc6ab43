package com.tapas.pando.analytics.api;

import com.tapas.pando.analytics.repository.WarehouseConnectionException;
import com.tapas.pando.analytics.repository.WarehouseQueryException;
import com.tapas.pando.analytics.service.UnsupportedDimensionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UnsupportedDimensionException.class)
    public ResponseEntity<ApiResult<Void>> handleUnsupportedDimension(UnsupportedDimensionException ex) {
        return ResponseEntity.badRequest()
                .body(ApiResult.error(HttpStatus.BAD_REQUEST.value(), ex.getMessage()));
    }

    @ExceptionHandler(WarehouseConnectionException.class)
    public ResponseEntity<ApiResult<Void>> handleConnectionFailure(WarehouseConnectionException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResult.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), ex.getMessage()));
    }

    @ExceptionHandler(WarehouseQueryException.class)
    public ResponseEntity<ApiResult<Void>> handleQueryFailure(WarehouseQueryException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResult.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), ex.getMessage()));
    }
}
