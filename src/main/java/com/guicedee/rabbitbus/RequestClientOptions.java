package com.guicedee.rabbitbus;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;

@Getter
@Setter
@Accessors(chain = true)
public class RequestClientOptions
{
    private Duration timeout = Duration.ofSeconds(30);
    private String exchangeName;
    private String routingKey;
    /**
     * Reply queue, the direct reply-to pseudo queue when not set
     */
    private String replyQueueName = "amq.rabbitmq.reply-to";
}
