package io.platoonmesh.wire;

import io.platoonmesh.model.JoinRequest;
import io.platoonmesh.model.LeaveNotice;
import io.platoonmesh.model.PeerId;
import io.platoonmesh.model.PlatoonMessage;
import io.platoonmesh.model.Roster;
import io.platoonmesh.model.Vector3;
import io.platoonmesh.model.VehicleState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

final class MessageCodecTest {

    @Test
    void bodyCarriesTypeTag() {
        String json = new String(MessageCodec.encode(new LeaveNotice(PeerId.of("veh-2"))), StandardCharsets.UTF_8);
        Assertions.assertTrue(json.contains("\"type\":\"LEAVE\""), json);
        Assertions.assertTrue(json.contains("\"peerId\":\"veh-2\""), json);
    }

    @Test
    void decodesEveryKind() {
        PeerId a = PeerId.of("veh-a");
        PeerId b = PeerId.of("veh-b");
        List<PlatoonMessage> messages = List.of(
                new VehicleState(a, new Vector3(1.5, -2.0, 0.1), new Vector3(3.0, 0.0, 0.0), 90.0, 42L, 1_000L),
                new JoinRequest(b, 2_000L),
                new LeaveNotice(a),
                new Roster(a, List.of(a, b))
        );
        for (PlatoonMessage message : messages) {
            Assertions.assertEquals(message, MessageCodec.decode(MessageCodec.encode(message)));
        }
    }

    @Test
    void unknownTypeIsRejected() {
        byte[] body = "{\"type\":\"TELEPORT\",\"peerId\":\"veh-1\"}".getBytes(StandardCharsets.UTF_8);
        Assertions.assertThrows(MessageFormatException.class, () -> MessageCodec.decode(body));
    }

    @Test
    void missingTypeAndGarbageAreRejected() {
        Assertions.assertThrows(MessageFormatException.class,
                () -> MessageCodec.decode("{\"peerId\":\"veh-1\"}".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(MessageFormatException.class,
                () -> MessageCodec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(MessageFormatException.class,
                () -> MessageCodec.decode("not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void blankPeerIdIsRejected() {
        byte[] body = "{\"type\":\"LEAVE\",\"peerId\":\"\"}".getBytes(StandardCharsets.UTF_8);
        Assertions.assertThrows(MessageFormatException.class, () -> MessageCodec.decode(body));
    }

    @Test
    void framesAreLengthPrefixed() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(buffer);
        Frames.write(out, new byte[]{1, 2, 3});
        Frames.write(out, new byte[0]);

        byte[] raw = buffer.toByteArray();
        Assertions.assertEquals(4 + 3 + 4, raw.length);
        Assertions.assertEquals(3, raw[3]);

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(raw));
        Assertions.assertArrayEquals(new byte[]{1, 2, 3}, Frames.read(in, 16));
        Assertions.assertArrayEquals(new byte[0], Frames.read(in, 16));
        Assertions.assertNull(Frames.read(in, 16));
    }

    @Test
    void oversizedFrameIsRejected() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Frames.write(new DataOutputStream(buffer), new byte[64]);
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(buffer.toByteArray()));
        Assertions.assertThrows(MessageFormatException.class, () -> Frames.read(in, 32));
    }

    @Test
    void greetingMustMatch() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        RelayHandshake.writeGreeting(new DataOutputStream(buffer));
        RelayHandshake.readGreeting(new DataInputStream(new ByteArrayInputStream(buffer.toByteArray())));

        ByteArrayOutputStream wrong = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(wrong);
        out.writeInt(0xCAFEBABE);
        out.writeInt(1);
        Assertions.assertThrows(MessageFormatException.class,
                () -> RelayHandshake.readGreeting(new DataInputStream(new ByteArrayInputStream(wrong.toByteArray()))));
    }
}
