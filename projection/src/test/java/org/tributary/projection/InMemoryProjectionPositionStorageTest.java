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

package org.tributary.projection;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.tributary.projection.sample.billing.RevenueProjector;
import org.tributary.projection.sample.shop.OrderListProjector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryProjectionPositionStorageTest {

    private final InMemoryProjectionPositionStorage storage = new InMemoryProjectionPositionStorage();

    @Test
    void unknown_projection_is_before_the_first_event() {
        assertThat(storage.read("unknown")).isEqualTo(ProjectionPositionStorage.BEFORE_FIRST_EVENT);
        assertThat(storage.exists("unknown")).isFalse();
    }

    @Test
    void position_never_decreases() {
        // Given
        storage.save("p", 5);

        // When
        long position = storage.save("p", 3);

        // Then
        assertThat(position).isEqualTo(5);
        assertThat(storage.read("p")).isEqualTo(5);
    }

    @Test
    void deleting_moves_the_projection_before_the_first_event() {
        // Given
        storage.save("p", 5);

        // When
        storage.delete("p");

        // Then
        assertThat(storage.exists("p")).isFalse();
        assertThat(storage.read("p")).isZero();
    }

    @Test
    void negative_positions_are_rejected() {
        assertThat(catchThrowable(() -> storage.save("p", -1))).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void projection_identifier_is_package_and_name_without_projector_suffix_in_lower_case() {
        assertThat(Projection.identifierFor(OrderListProjector.class)).isEqualTo("org.tributary.projection.sample.shop:orderlist");
        assertThat(Projection.identifierFor(RevenueProjector.class)).isEqualTo("org.tributary.projection.sample.billing:revenue");
    }
}
