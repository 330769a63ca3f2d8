package com.qdrantup.uploader.client;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.MethodDescriptor;

/**
 * Compresses every outgoing request message with a fixed gRPC codec.
 */
final class CompressionInterceptor implements ClientInterceptor {

    private final String codecName;

    CompressionInterceptor(String codecName) {
        this.codecName = codecName;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
        return next.newCall(method, callOptions.withCompression(codecName));
    }
}
