package com.chicu.homeprice.ml.drift;

public class BaselineUnavailableException extends RuntimeException {

    public BaselineUnavailableException(String message) {
        super(message);
    }

    public BaselineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
