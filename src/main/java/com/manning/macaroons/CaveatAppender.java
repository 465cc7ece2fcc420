package com.manning.macaroons;

public class CaveatAppender {
    public static void main(String... args) {
        if (args.length < 1) {
            System.err.println("usage: CaveatAppender <macaroon> [caveat...]");
            System.exit(2);
        }
        var macaroon = Macaroon.deserialize(args[0]);
        for (int i = 1; i < args.length; ++i) {
            var caveat = args[i];
            macaroon.addFirstPartyCaveat(caveat);
        }
        System.out.println(macaroon.serialize());
    }
}
