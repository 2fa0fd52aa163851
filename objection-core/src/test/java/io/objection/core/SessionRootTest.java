package io.objection.core;

import io.objection.json.spi.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.objection.core.Fixtures.json;
import static io.objection.core.Fixtures.root;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRootTest {

    @Test
    void mountEventYieldsTokenAndConsumesPayload() throws Exception {
        SessionRoot root = root(EventPath.of("root_app_ready"), "{\"token\":\"abc\"}");

        Optional<MountData> mount = root.takeMountEvent();

        assertThat(mount).contains(new MountData("abc"));
        assertThat(mount.get().optionalToken()).contains("abc");
        assertThat(root.hasEventData()).isFalse();
    }

    @Test
    void mountEventAcceptsNullOrMissingToken() throws Exception {
        assertThat(root(EventPath.of("root_app_ready"), "{\"token\":null}").takeMountEvent())
                .contains(new MountData(null));
        assertThat(root(EventPath.of("root_app_ready"), "{}").takeMountEvent())
                .hasValueSatisfying(m -> assertThat(m.optionalToken()).isEmpty());
    }

    @Test
    void otherEventsAreNotMountsAndKeepTheirPayload() throws Exception {
        SessionRoot root = root(EventPath.of("other"), "{\"token\":\"abc\"}");

        assertThat(root.takeMountEvent()).isEmpty();
        assertThat(root.hasEventData()).isTrue();
    }

    @Test
    void onlyTheFirstSegmentMarksAMount() throws Exception {
        SessionRoot root = root(EventPath.of("main", "root_app_ready"), "{\"token\":\"abc\"}");

        assertThat(root.takeMountEvent()).isEmpty();
        assertThat(root.hasEventData()).isTrue();
    }

    @Test
    void emptyPathIsNeverValid() {
        SessionRoot root = root(EventPath.empty(), "{}");

        assertThatThrownBy(root::takeMountEvent).isInstanceOf(MountException.EmptyEventPath.class);
    }

    @Test
    void mountWithoutDataFails() throws Exception {
        SessionRoot root = root(EventPath.of("root_app_ready"), null);

        assertThatThrownBy(root::takeMountEvent).isInstanceOf(MountException.NoEventData.class);

        SessionRoot twice = root(EventPath.of("root_app_ready"), "{}");
        twice.takeMountEvent();
        assertThatThrownBy(twice::takeMountEvent).isInstanceOf(MountException.NoEventData.class);
    }

    @Test
    void mountWithTheWrongShapeFails() {
        assertThatThrownBy(() -> root(EventPath.of("root_app_ready"), "\"abc\"").takeMountEvent())
                .isInstanceOf(MountException.FailedToDeserializeMountData.class);
        assertThatThrownBy(() -> root(EventPath.of("root_app_ready"), "null").takeMountEvent())
                .isInstanceOf(MountException.FailedToDeserializeMountData.class);
        assertThatThrownBy(() -> root(EventPath.of("root_app_ready"), "{\"token\":{\"nested\":1}}").takeMountEvent())
                .isInstanceOf(MountException.FailedToDeserializeMountData.class)
                .hasMessageContaining("mount data structure");
    }

    @Test
    void mountTokenOfAnotherScalarKindFails() {
        assertThatThrownBy(() -> root(EventPath.of("root_app_ready"), "{\"token\":5}").takeMountEvent())
                .isInstanceOf(MountException.FailedToDeserializeMountData.class);
        assertThatThrownBy(() -> root(EventPath.of("root_app_ready"), "{\"token\":true}").takeMountEvent())
                .isInstanceOf(MountException.FailedToDeserializeMountData.class);
        assertThatThrownBy(() -> root(EventPath.of("root_app_ready"), "{\"token\":1.5}").takeMountEvent())
                .isInstanceOf(MountException.FailedToDeserializeMountData.class);
    }

    @Test
    void setRootUiAppendsEveryTime() {
        SessionRoot root = root(EventPath.of("root_app_ready"), "{}");

        root.setRootUi(ComponentIndex.of(Map.of("type", "Center")));
        root.setRootUi(ComponentIndex.of(Map.of("type", "Header")));
        List<JsonNode> actions = root.intoResponse().actions();

        assertThat(actions).containsExactly(
                json("{\"key\":{\"actionPath\":[\"root_mount\"],\"debugSymbol\":null},\"data\":{\"type\":\"Center\"}}"),
                json("{\"key\":{\"actionPath\":[\"root_mount\"],\"debugSymbol\":null},\"data\":{\"type\":\"Header\"}}"));
    }

    @Test
    void onlyOneClientAtATime() {
        SessionRoot root = root(EventPath.of("main"), null);

        Client first = root.getClient();
        assertThatThrownBy(root::getClient).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> root.setRootUi(ComponentIndex.of("x"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(root::takeMountEvent).isInstanceOf(IllegalStateException.class);

        first.close();
        first.close();
        assertThat(first.isOpen()).isFalse();
        try (Client second = root.getClient()) {
            assertThat(second.isOpen()).isTrue();
            assertThatThrownBy(first::ui).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void withClientReleasesEvenWhenTheWorkFails() {
        SessionRoot root = root(EventPath.of("main"), null);

        assertThatThrownBy(() -> root.withClient(client -> {
            throw new IllegalArgumentException("nope");
        })).hasMessage("nope");

        String scope = root.withClient(client -> client.ui().path().get(0).value());
        assertThat(scope).isEqualTo("main");
    }

    @Test
    void finalizedRootRejectsEverything() {
        SessionRoot root = root(EventPath.of("main"), null);
        Client client = root.getClient();

        UiResponse response = root.intoResponse();

        assertThat(response.actions()).isEmpty();
        assertThat(client.isOpen()).isFalse();
        assertThatThrownBy(client::ui).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(root::getClient).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(root::intoResponse).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> root.setRootUi(ComponentIndex.of("x"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void actionsKeepEmissionOrderAcrossRootAndClient() {
        SessionRoot root = root(EventPath.of("root_app_ready"), "{}");
        ActionKey<String> title = ActionKey.create();

        root.setRootUi(ComponentIndex.of("app"));
        root.withClient(client -> {
            title.emit("Hello", client);
            return null;
        });
        List<JsonNode> actions = root.intoResponse().actions();

        assertThat(actions.stream().map(a -> a.get("data").asText())).containsExactly("app", "Hello");
    }
}
