package com.demo.errcode;

import io.grpc.Status;

/**
 * An error carrying an explicit canonical code.
 */
public interface CodedError {

    Status.Code code();
}
