package org.github.zzf.mqtt.bus.transport.netty;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletionException;
import org.github.zzf.mqtt.bus.BusOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class NettyTransportTest {

    @ParameterizedTest(name = "{0} -> {1}:{2}")
    @CsvSource({
        "mqtt://localhost,localhost,1883",
        "mqtt://localhost:1884,localhost,1884",
        "tcp://10.0.0.1:18830,10.0.0.1,18830",
        "' mqtt://broker.example.org ',broker.example.org,1883",
    })
    void givenUrl_whenRemoteAddress_thenHostAndPort(String url, String host, int port) {
        InetSocketAddress address = NettyTransport.remoteAddress(url);
        then(address.getHostString()).isEqualTo(host);
        then(address.getPort()).isEqualTo(port);
        then(address.isUnresolved()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://localhost", "ws://localhost:8083", "localhost:1883", "mqtt://", "mqtt:// bad"})
    void givenIllegalUrl_whenRemoteAddress_thenException(String url) {
        thenThrownBy(() -> NettyTransport.remoteAddress(url)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void givenNoUrl_whenConnect_thenFailedStage() {
        NettyTransport transport = new NettyTransport();
        thenThrownBy(() -> transport.connect(new BusOptions().setClientId("c1")).toCompletableFuture().join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

}
