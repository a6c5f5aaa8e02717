package com.guicedee.rabbitbus.topology;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class TopologyOptions
{
    /**
     * Declare a direct dead letter exchange and queue beside every configured message and consumer
     */
    private boolean autoConfigureDeadLetter = true;
    private boolean autoConfigureRetryQueues;
    private int retryLevels = 3;

    public TopologyOptions copy()
    {
        return new TopologyOptions()
                .setAutoConfigureDeadLetter(autoConfigureDeadLetter)
                .setAutoConfigureRetryQueues(autoConfigureRetryQueues)
                .setRetryLevels(retryLevels);
    }
}
