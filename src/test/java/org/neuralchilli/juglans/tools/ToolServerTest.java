package org.neuralchilli.juglans.tools;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ToolServerTest {

    @Test
    void shouldParseFullEntry() {
        ToolServer server = ToolServer.parse("search|http://localhost:9000/|web|secret");

        assertThat(server.name()).isEqualTo("search");
        assertThat(server.namespace()).isEqualTo("web");
        assertThat(server.token()).isEqualTo("secret");
        assertThat(server.messagesUrl()).isEqualTo("http://localhost:9000/messages");
    }

    @Test
    void shouldDefaultNamespaceToName() {
        ToolServer server = ToolServer.parse("files|http://host/messages");

        assertThat(server.alias()).isNull();
        assertThat(server.token()).isNull();
        assertThat(server.namespace()).isEqualTo("files");
        assertThat(server.messagesUrl()).isEqualTo("http://host/messages");
    }

    @Test
    void shouldTreatBlankOptionalPartsAsMissing() {
        ToolServer server = ToolServer.parse("files|http://host||");

        assertThat(server.alias()).isNull();
        assertThat(server.token()).isNull();
    }

    @Test
    void shouldRejectMalformedEntries() {
        assertThatThrownBy(() -> ToolServer.parse("only-a-name"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name|url");
        assertThatThrownBy(() -> ToolServer.parse("name|"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a URL");
        assertThatThrownBy(() -> ToolServer.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
