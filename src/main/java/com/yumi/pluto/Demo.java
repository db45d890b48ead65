package com.yumi.pluto;

import com.yumi.pluto.exception.KeyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * 示例：反复写入、读取、删除几个 key。参数为工作目录，默认当前目录。
 */
public class Demo {
    private static final Logger LOG = LoggerFactory.getLogger(Demo.class);

    public static void main(String[] args) {
        String dir = args.length > 0 ? args[0] : Config.DEFAULT_DIR;
        Engine engine = Engine.open(Config.newConfig(dir));
        try {
            for (int i = 0; i < 1000; i++) {
                engine.put(bytes("k1"), bytes("v1"));
                engine.put(bytes("k2"), bytes("v2"));
                engine.put(bytes("k3"), bytes("v3"));

                LOG.info("get k1: {}", new String(engine.get(bytes("k1")), StandardCharsets.UTF_8));

                engine.delete(bytes("k1"));
                LOG.info("delete k1");

                try {
                    engine.get(bytes("k1"));
                } catch (KeyNotFoundException e) {
                    LOG.info("get k1: {}", e.getMessage());
                }
            }
        } finally {
            engine.close();
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
