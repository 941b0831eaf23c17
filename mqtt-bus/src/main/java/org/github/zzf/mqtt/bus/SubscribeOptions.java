package org.github.zzf.mqtt.bus;

import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class SubscribeOptions {

    private int qos;

    public static SubscribeOptions qos(int qos) {
        return new SubscribeOptions().setQos(qos);
    }

}
