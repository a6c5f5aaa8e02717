package com.guicedee.rabbitbus;

import lombok.Value;

/**
 * A request/response pair and the options the request client is created with
 */
@Value
public class RequestClientRegistration<Q, R>
{
    Class<Q> requestType;
    Class<R> responseType;
    RequestClientOptions options;
}
