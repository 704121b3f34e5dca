package me.internalizable.authgate.dto;

public record ErrorResponse(String error, boolean success) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, false);
    }
}
