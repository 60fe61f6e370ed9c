package com.example.loqueue.service;

public class PayloadCodecException extends RuntimeException {
    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
