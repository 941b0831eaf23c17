package org.github.zzf.mqtt.bus;

import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class PublishOptions {

    private int qos;
    private boolean retain;

    public static PublishOptions qos(int qos) {
        return new PublishOptions().setQos(qos);
    }

}
