package com.manning.macaroons;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.manning.macaroons.json.MacaroonJson;

/**
 * Prints the JSON form of each serialized macaroon slice given on the
 * command line.
 */
public class MacaroonInspector {
    private static final Logger logger = LoggerFactory.getLogger(MacaroonInspector.class);

    public static void main(String... args) {
        var json = MacaroonJson.fromConfig();
        var failed = false;
        for (var arg : args) {
            try {
                var slice = MacaroonSlice.deserialize(arg);
                System.out.println(json.write(slice).toString(2));
            } catch (MacaroonFormatException e) {
                logger.error("Cannot read macaroon {}", arg, e);
                failed = true;
            }
        }
        if (failed) {
            System.exit(1);
        }
    }
}
