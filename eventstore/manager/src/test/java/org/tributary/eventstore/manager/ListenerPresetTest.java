/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.eventstore.manager;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ListenerPresetTest {

    @Test
    void active_preset_is_enabled_without_options() {
        // When
        ListenerPreset preset = ListenerPreset.active();

        // Then
        assertThat(preset.enabled()).isTrue();
        assertThat(preset.options()).isEmpty();
    }

    @Test
    void active_preset_carries_its_options() {
        // When
        ListenerPreset preset = ListenerPreset.active(Map.of("someOption", 1));

        // Then
        assertThat(preset.enabled()).isTrue();
        assertThat(preset.options()).containsExactly(Map.entry("someOption", 1));
    }

    @Test
    void inactive_preset_is_not_an_active_listener_preset_of_its_registration() {
        // Given
        EventStoreRegistration registration = EventStoreRegistration.builder("default").storage("inmemory").fallback()
                .listeners("org\\.acme\\..*")
                .listeners("org\\.legacy\\..*", ListenerPreset.inactive())
                .build();

        // Then
        assertThat(ListenerPreset.inactive().enabled()).isFalse();
        assertThat(registration.activeListenerPresets()).containsOnlyKeys("org\\.acme\\..*");
    }
}
