package com.manning.macaroons.json;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.google.common.base.Utf8;
import com.google.common.io.BaseEncoding;
import com.manning.macaroons.Macaroon;
import com.manning.macaroons.MacaroonConfig;
import com.manning.macaroons.MacaroonFormatException;
import com.manning.macaroons.MacaroonSlice;
import com.manning.macaroons.packet.Field;
import com.manning.macaroons.packet.PacketBuffer;

/**
 * JSON form of macaroons:
 *
 * <pre>
 * {"location": "...", "identifier": "...", "signature": "&lt;hex&gt;", "caveats": ...}
 * </pre>
 *
 * where {@code caveats} is either a hex string of the raw caveat packets or
 * an array of {@code {"cid", "vid", "cl"}} objects, {@code vid} being
 * base64. Both shapes are accepted when reading. An identifier or caveat id
 * that is not well-formed UTF-8 is written as base64 under
 * {@code identifier64} or {@code cid64} instead.
 */
public final class MacaroonJson {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();
    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    private final CaveatForm form;

    public MacaroonJson(CaveatForm form) {
        this.form = form;
    }

    public static MacaroonJson fromConfig() {
        return new MacaroonJson(MacaroonConfig.jsonCaveatForm());
    }

    public JSONObject write(Macaroon macaroon) {
        var json = new JSONObject();
        json.put("location", macaroon.location());
        putText(json, "identifier", macaroon.id());
        json.put("signature", HEX.encode(macaroon.signature()));
        if (form == CaveatForm.COMPACT) {
            json.put("caveats", HEX.encode(macaroon.caveatBytes()));
        } else {
            var caveats = new JSONArray();
            for (var cav : macaroon.caveats()) {
                var cavJson = new JSONObject();
                putText(cavJson, "cid", cav.caveatId());
                if (cav.isThirdParty()) {
                    cavJson.put("vid", BASE64.encode(cav.verificationId()));
                }
                if (!cav.location().isEmpty()) {
                    cavJson.put("cl", cav.location());
                }
                caveats.put(cavJson);
            }
            json.put("caveats", caveats);
        }
        return json;
    }

    public String toJson(Macaroon macaroon) {
        return write(macaroon).toString();
    }

    public JSONArray write(MacaroonSlice slice) {
        var array = new JSONArray();
        for (var macaroon : slice) {
            array.put(write(macaroon));
        }
        return array;
    }

    public Macaroon read(JSONObject json) {
        try {
            var out = new ByteArrayOutputStream();
            writePacket(out, Field.LOCATION, utf8(json.optString("location", "")));
            writePacket(out, Field.IDENTIFIER, readText(json, "identifier"));

            var caveats = json.opt("caveats");
            if (caveats instanceof String) {
                var raw = decode(HEX, ((String) caveats).toLowerCase(), "caveats");
                out.write(raw, 0, raw.length);
            } else if (caveats instanceof JSONArray) {
                writeCaveats(out, (JSONArray) caveats);
            } else if (caveats != null && caveats != JSONObject.NULL) {
                throw new MacaroonFormatException("cannot decode macaroon caveats");
            }

            var signature = decode(HEX, json.getString("signature").toLowerCase(), "signature");
            writePacket(out, Field.SIGNATURE, signature);
            return Macaroon.fromByteArray(out.toByteArray());
        } catch (JSONException e) {
            throw new MacaroonFormatException("cannot unmarshal json data: " + e.getMessage(), e);
        }
    }

    public Macaroon fromJson(String json) {
        try {
            return read(new JSONObject(json));
        } catch (JSONException e) {
            throw new MacaroonFormatException("cannot unmarshal json data: " + e.getMessage(), e);
        }
    }

    public MacaroonSlice read(JSONArray array) {
        var slice = new MacaroonSlice();
        for (int i = 0; i < array.length(); i++) {
            slice.add(read(array.getJSONObject(i)));
        }
        return slice;
    }

    private static void writeCaveats(ByteArrayOutputStream out, JSONArray caveats) {
        for (int i = 0; i < caveats.length(); i++) {
            var cav = caveats.getJSONObject(i);
            writePacket(out, Field.CAVEAT_ID, readText(cav, "cid"));
            var vid = cav.optString("vid", "");
            if (!vid.isEmpty()) {
                writePacket(out, Field.VERIFICATION_ID, decode(BASE64, vid, "caveat verification id"));
            }
            var location = cav.optString("cl", "");
            if (!location.isEmpty()) {
                writePacket(out, Field.CAVEAT_LOCATION, utf8(location));
            }
        }
    }

    private static void putText(JSONObject json, String key, byte[] value) {
        if (Utf8.isWellFormed(value)) {
            json.put(key, new String(value, StandardCharsets.UTF_8));
        } else {
            json.put(key + "64", BASE64.encode(value));
        }
    }

    private static byte[] readText(JSONObject json, String key) {
        if (json.has(key + "64")) {
            return decode(BASE64, json.getString(key + "64"), key);
        }
        return utf8(json.getString(key));
    }

    private static void writePacket(ByteArrayOutputStream out, Field field, byte[] payload) {
        if (!PacketBuffer.writePacket(out, field, payload)) {
            throw new MacaroonFormatException("macaroon " + field + " too big");
        }
    }

    private static byte[] decode(BaseEncoding encoding, String value, String what) {
        try {
            return encoding.decode(value);
        } catch (IllegalArgumentException e) {
            throw new MacaroonFormatException("cannot decode macaroon " + what + ": " + e.getMessage(), e);
        }
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
