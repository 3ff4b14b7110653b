package com.chicu.homeprice.ml.registry;

/**
 * Указателя на активный запуск нет: модель ещё ни разу не публиковалась.
 */
public class NotRegisteredException extends RegistryException {

    public NotRegisteredException(String message) {
        super(message);
    }
}
