package com.epam.aidial.deployer.util;

public class ResourceNotFoundException extends HttpException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
