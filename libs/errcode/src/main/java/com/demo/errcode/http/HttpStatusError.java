package com.demo.errcode.http;

/**
 * An error carrying an explicit HTTP status code.
 */
public interface HttpStatusError {

    int httpStatus();
}
