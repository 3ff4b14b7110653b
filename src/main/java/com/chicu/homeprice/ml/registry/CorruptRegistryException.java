package com.chicu.homeprice.ml.registry;

/**
 * Указатель есть, но запуск, на который он ссылается, отсутствует или неполный.
 */
public class CorruptRegistryException extends RegistryException {

    public CorruptRegistryException(String message) {
        super(message);
    }

    public CorruptRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
