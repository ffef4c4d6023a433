package com.epam.aidial.deployer.util;

public class ServiceUnavailableException extends HttpException {

    public ServiceUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }
}
