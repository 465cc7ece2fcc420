package com.manning.macaroons.json;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import com.manning.macaroons.ConditionChecker;
import com.manning.macaroons.Macaroon;
import com.manning.macaroons.MacaroonFormatException;
import com.manning.macaroons.MacaroonSlice;
import com.manning.macaroons.payload.CaveatSchema;

class MacaroonJsonTest {

    @Test
    void compactFormWritesCaveatsAsHex() {
        var m = Macaroon.create(bytes("root-key"), "some id", "a location");
        m.addFirstPartyCaveat("account = 3735928559");

        var json = new MacaroonJson(CaveatForm.COMPACT).write(m);

        assertEquals("a location", json.getString("location"));
        assertEquals("some id", json.getString("identifier"));
        assertEquals(64, json.getString("signature").length());
        // one cid packet: 3 byte header plus 20 byte condition
        assertEquals("1700046163636f756e74203d2033373335393238353539", json.getString("caveats"));
    }

    @Test
    void compactRoundTripKeepsCaveatBytes() {
        var m = macaroonWithBothCaveatKinds();
        var json = new MacaroonJson(CaveatForm.COMPACT);

        var read = json.fromJson(json.toJson(m));

        assertArrayEquals(m.caveatBytes(), read.caveatBytes());
        assertArrayEquals(m.toByteArray(), read.toByteArray());
    }

    @Test
    void legacyRoundTripKeepsCaveatBytes() {
        var m = macaroonWithBothCaveatKinds();
        var json = new MacaroonJson(CaveatForm.LEGACY);

        var read = json.fromJson(json.toJson(m));

        assertArrayEquals(m.caveatBytes(), read.caveatBytes());
        assertArrayEquals(m.toByteArray(), read.toByteArray());
    }

    @Test
    void legacyFormWritesOneObjectPerCaveat() {
        var m = macaroonWithBothCaveatKinds();

        var caveats = new MacaroonJson(CaveatForm.LEGACY).write(m).getJSONArray("caveats");

        assertEquals(2, caveats.length());
        var first = caveats.getJSONObject(0);
        assertEquals("wonderful", first.getString("cid"));
        assertFalse(first.has("vid"));
        assertFalse(first.has("cl"));
        var third = caveats.getJSONObject(1);
        assertEquals("bob-is-great", third.getString("cid"));
        assertEquals("bob", third.getString("cl"));
        assertFalse(third.getString("vid").isEmpty());
    }

    @Test
    void legacyFormKeepsBinaryCaveatIds() {
        var schema = CaveatSchema.builder(() -> new int[1])
                .int32(a -> a[0], (a, v) -> a[0] = v)
                .build();
        var m = Macaroon.create(bytes("root-key"), "root-id", "");
        m.addFirstPartyCaveat(schema.encode(new int[] { -1 }));
        var json = new MacaroonJson(CaveatForm.LEGACY);

        var written = json.write(m);
        var read = json.fromJson(written.toString());

        var cav = written.getJSONArray("caveats").getJSONObject(0);
        assertFalse(cav.has("cid"));
        assertEquals("AAT/////", cav.getString("cid64"));
        assertArrayEquals(m.caveatBytes(), read.caveatBytes());
        read.verify(bytes("root-key"), condition -> {
        }, null);
    }

    @Test
    void binaryIdentifierIsWrittenAsBase64() {
        var id = new byte[] { 'i', (byte) 0xc3 };
        var m = Macaroon.create(bytes("root-key"), id, new byte[0]);
        var json = new MacaroonJson(CaveatForm.COMPACT);

        var written = json.write(m);
        var read = json.fromJson(written.toString());

        assertFalse(written.has("identifier"));
        assertArrayEquals(id, read.id());
        assertArrayEquals(m.toByteArray(), read.toByteArray());
    }

    @Test
    void readerAcceptsEitherCaveatShape() {
        var m = macaroonWithBothCaveatKinds();
        var legacy = new MacaroonJson(CaveatForm.LEGACY).toJson(m);

        var read = new MacaroonJson(CaveatForm.COMPACT).fromJson(legacy);

        assertArrayEquals(m.toByteArray(), read.toByteArray());
    }

    @Test
    void upperCaseHexIsAccepted() {
        var m = macaroonWithBothCaveatKinds();
        var json = new MacaroonJson(CaveatForm.COMPACT).write(m);
        json.put("signature", json.getString("signature").toUpperCase());
        json.put("caveats", json.getString("caveats").toUpperCase());

        assertArrayEquals(m.toByteArray(), new MacaroonJson(CaveatForm.COMPACT).read(json).toByteArray());
    }

    @Test
    void macaroonWithoutCaveats() {
        var m = Macaroon.create(bytes("root-key"), "some id", "");
        var json = new MacaroonJson(CaveatForm.LEGACY);

        var read = json.fromJson(json.toJson(m));

        assertArrayEquals(m.toByteArray(), read.toByteArray());
        read.verify(bytes("root-key"));
    }

    @Test
    void sliceRoundTripVerifies() {
        var primary = macaroonWithBothCaveatKinds();
        var discharge = Macaroon.create(bytes("bob-key"), "bob-is-great", "bob");
        var slice = MacaroonSlice.of(primary, discharge);
        slice.bindDischarges();
        var json = new MacaroonJson(CaveatForm.COMPACT);

        var array = new JSONArray(json.write(slice).toString());
        var read = json.read(array);

        assertArrayEquals(slice.toByteArray(), read.toByteArray());
        read.verify(bytes("root-key"), ConditionChecker.exact("wonderful"));
    }

    @Test
    void invalidJsonIsRejected() {
        var e = assertThrows(MacaroonFormatException.class,
                () -> new MacaroonJson(CaveatForm.COMPACT).fromJson("{not json"));
        assertTrue(e.getMessage().startsWith("cannot unmarshal json data: "), e.getMessage());
    }

    @Test
    void missingSignatureIsRejected() {
        var json = new JSONObject().put("location", "").put("identifier", "id");

        var e = assertThrows(MacaroonFormatException.class, () -> new MacaroonJson(CaveatForm.COMPACT).read(json));
        assertTrue(e.getMessage().startsWith("cannot unmarshal json data: "), e.getMessage());
    }

    @Test
    void badHexIsRejected() {
        var m = Macaroon.create(bytes("root-key"), "some id", "");
        var json = new MacaroonJson(CaveatForm.COMPACT).write(m).put("signature", "zz");

        assertThrows(MacaroonFormatException.class, () -> new MacaroonJson(CaveatForm.COMPACT).read(json));
    }

    @Test
    void wrongCaveatsTypeIsRejected() {
        var m = Macaroon.create(bytes("root-key"), "some id", "");
        var json = new MacaroonJson(CaveatForm.COMPACT).write(m).put("caveats", 42);

        var e = assertThrows(MacaroonFormatException.class, () -> new MacaroonJson(CaveatForm.COMPACT).read(json));
        assertEquals("cannot decode macaroon caveats", e.getMessage());
    }

    private static Macaroon macaroonWithBothCaveatKinds() {
        var m = Macaroon.create(bytes("root-key"), "root-id", "http://example.com");
        m.addFirstPartyCaveat("wonderful");
        m.addThirdPartyCaveat(bytes("bob-key"), "bob-is-great", "bob");
        return m;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
