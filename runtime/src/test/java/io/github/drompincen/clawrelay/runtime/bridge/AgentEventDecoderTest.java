package io.github.drompincen.clawrelay.runtime.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawrelay.protocol.event.AgentEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AgentEventDecoderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AgentEventDecoder decoder = new AgentEventDecoder();

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw.replace('\'', '"'));
    }

    @Test
    void decodesTextDelta() throws Exception {
        AgentEvent event = decoder.decode(json(
                "{'type':'message.part.updated','properties':{'part':{'id':'p1','type':'text','text':'po',"
                        + "'sessionID':'ses_1'},'delta':'po'}}"));

        assertThat(event).isInstanceOf(AgentEvent.TextPartUpdated.class);
        AgentEvent.TextPartUpdated update = (AgentEvent.TextPartUpdated) event;
        assertThat(update.sessionId()).isEqualTo("ses_1");
        assertThat(update.partId()).isEqualTo("p1");
        assertThat(update.hasDelta()).isTrue();
        assertThat(update.completed()).isFalse();
    }

    @Test
    void decodesCompletedTextPart() throws Exception {
        AgentEvent event = decoder.decode(json(
                "{'type':'message.part.updated','properties':{'part':{'id':'p1','type':'text','text':'pong',"
                        + "'sessionID':'ses_1','time':{'start':1,'end':2}}}}"));

        AgentEvent.TextPartUpdated update = (AgentEvent.TextPartUpdated) event;
        assertThat(update.completed()).isTrue();
        assertThat(update.hasDelta()).isFalse();
        assertThat(update.text()).isEqualTo("pong");
    }

    @Test
    void nonTextPartsAreOther() throws Exception {
        AgentEvent event = decoder.decode(json(
                "{'type':'message.part.updated','properties':{'part':{'id':'t1','type':'tool','sessionID':'ses_1'}}}"));

        assertThat(event).isInstanceOf(AgentEvent.Other.class);
        assertThat(event.sessionId()).isEqualTo("ses_1");
    }

    @Test
    void permissionIdFallsBackThroughAliases() throws Exception {
        AgentEvent asked = decoder.decode(json(
                "{'type':'permission.asked','properties':{'requestID':'r1','sessionID':'ses_1','permission':'bash',"
                        + "'metadata':{'command':'ls'}}}"));
        AgentEvent updated = decoder.decode(json(
                "{'type':'permission.updated','properties':{'permissionID':'r2','sessionID':'ses_1','type':'edit'}}"));

        AgentEvent.PermissionAsked a = (AgentEvent.PermissionAsked) asked;
        assertThat(a.requestId()).isEqualTo("r1");
        assertThat(a.tool()).isEqualTo("bash");
        assertThat(a.input().get("command").asText()).isEqualTo("ls");
        AgentEvent.PermissionUpdated u = (AgentEvent.PermissionUpdated) updated;
        assertThat(u.requestId()).isEqualTo("r2");
        assertThat(u.tool()).isEqualTo("edit");
    }

    @Test
    void sessionErrorMessagePrecedence() throws Exception {
        AgentEvent withData = decoder.decode(json(
                "{'type':'session.error','properties':{'sessionID':'s','error':{'name':'ApiError','data':{'message':'quota'}}}}"));
        AgentEvent withName = decoder.decode(json(
                "{'type':'session.error','properties':{'sessionID':'s','error':{'name':'ApiError'}}}"));
        AgentEvent bare = decoder.decode(json("{'type':'session.error','properties':{'sessionID':'s'}}"));

        assertThat(((AgentEvent.SessionError) withData).message()).isEqualTo("quota");
        assertThat(((AgentEvent.SessionError) withName).message()).isEqualTo("ApiError");
        assertThat(((AgentEvent.SessionError) bare).message()).isEqualTo(AgentEventDecoder.DEFAULT_ERROR);
    }

    @Test
    void sessionIdIsTakenFromInfoWhenNoDirectField() throws Exception {
        AgentEvent event = decoder.decode(json("{'type':'session.updated','properties':{'info':{'id':'ses_7'}}}"));

        assertThat(event.sessionId()).isEqualTo("ses_7");
        assertThat(event.type()).isEqualTo("session.updated");
    }

    @Test
    void idleCarriesSessionId() throws Exception {
        AgentEvent event = decoder.decode(json("{'type':'session.idle','properties':{'sessionID':'ses_1'}}"));

        assertThat(event).isEqualTo(new AgentEvent.SessionIdle("ses_1"));
    }
}
