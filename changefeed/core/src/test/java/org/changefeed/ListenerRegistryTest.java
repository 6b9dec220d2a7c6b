package org.changefeed;

import org.changefeed.ListenerRegistry.RegisteredListener;
import org.changefeed.api.ListenerRegistration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("ListenerRegistry")
@DisplayNameGeneration(ReplaceUnderscores.class)
class ListenerRegistryTest {

    private AtomicInteger populated;
    private AtomicInteger emptied;
    private ListenerRegistry<String> registry;

    @BeforeEach
    void registry_is_created_before_each_test() {
        populated = new AtomicInteger();
        emptied = new AtomicInteger();
        registry = new ListenerRegistry<>(populated::incrementAndGet, emptied::incrementAndGet);
    }

    @Test
    void signals_when_first_listener_is_added_and_last_listener_is_removed() {
        // Given
        ListenerRegistration registration1 = ListenerRegistration.random();
        ListenerRegistration registration2 = ListenerRegistration.random();

        // When
        registry.add(registration1, __ -> {
        });
        registry.add(registration2, __ -> {
        });
        registry.remove(registration1);

        // Then
        assertAll(
                () -> assertThat(populated).hasValue(1),
                () -> assertThat(emptied).hasValue(0)
        );

        // When
        registry.remove(registration2);

        // Then
        assertAll(
                () -> assertThat(populated).hasValue(1),
                () -> assertThat(emptied).hasValue(1),
                () -> assertThat(registry.isEmpty()).isTrue()
        );
    }

    @Test
    void signals_again_when_populated_after_being_emptied() {
        // Given
        ListenerRegistration registration = ListenerRegistration.random();
        registry.add(registration, __ -> {
        });
        registry.remove(registration);

        // When
        registry.add(ListenerRegistration.random(), __ -> {
        });

        // Then
        assertAll(
                () -> assertThat(populated).hasValue(2),
                () -> assertThat(emptied).hasValue(1)
        );
    }

    @Test
    void removing_an_unknown_or_already_removed_listener_is_a_no_op() {
        // Given
        ListenerRegistration registration = ListenerRegistration.random();
        registry.add(registration, __ -> {
        });

        // When
        boolean removedUnknown = registry.remove(ListenerRegistration.random());
        boolean removedFirst = registry.remove(registration);
        boolean removedSecond = registry.remove(registration);

        // Then
        assertAll(
                () -> assertThat(removedUnknown).isFalse(),
                () -> assertThat(removedFirst).isTrue(),
                () -> assertThat(removedSecond).isFalse(),
                () -> assertThat(emptied).hasValue(1)
        );
    }

    @Test
    void adding_the_same_registration_twice_throws_iae() {
        // Given
        ListenerRegistration registration = ListenerRegistration.random();
        registry.add(registration, __ -> {
        });

        // When
        Throwable throwable = catchThrowable(() -> registry.add(registration, __ -> {
        }));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Listener " + registration.id() + " is already registered.");
    }

    @Test
    void snapshot_is_not_affected_by_later_changes_but_reports_removed_listeners_as_inactive() {
        // Given
        CopyOnWriteArrayList<String> received = new CopyOnWriteArrayList<>();
        ListenerRegistration registration = ListenerRegistration.random();
        registry.add(registration, received::add);
        List<RegisteredListener<String>> snapshot = registry.snapshot();

        // When
        registry.remove(registration);
        registry.add(ListenerRegistration.random(), __ -> {
        });

        // Then
        assertAll(
                () -> assertThat(snapshot).hasSize(1),
                () -> assertThat(snapshot.get(0).isActive()).isFalse(),
                () -> assertThat(snapshot.get(0).registration()).isEqualTo(registration),
                () -> assertThat(registry.snapshot()).hasSize(1)
        );
    }

    @Test
    void clear_removes_all_listeners_without_signalling() {
        // Given
        registry.add(ListenerRegistration.random(), __ -> {
        });
        registry.add(ListenerRegistration.random(), __ -> {
        });
        List<RegisteredListener<String>> snapshot = registry.snapshot();

        // When
        registry.clear();

        // Then
        assertAll(
                () -> assertThat(registry.size()).isZero(),
                () -> assertThat(emptied).hasValue(0),
                () -> assertThat(snapshot).noneMatch(RegisteredListener::isActive)
        );
    }
}
