/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.nfaregex.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PatternReaderTest {

    @Test
    void getAndUnget_moveCursor() {
        PatternReader reader = new PatternReader("ab");

        assertThat(reader.peek()).isEqualTo('a');
        assertThat(reader.get()).isEqualTo('a');
        assertThat(reader.position()).isEqualTo(1);
        reader.unget();
        assertThat(reader.get()).isEqualTo('a');
        assertThat(reader.get()).isEqualTo('b');
        assertThat(reader.atEnd()).isTrue();
    }

    @Test
    void get_atEnd_returnsEofWithoutAdvancing() {
        PatternReader reader = new PatternReader("a");
        reader.get();

        assertThat(reader.get()).isEqualTo(PatternReader.EOF);
        assertThat(reader.peek()).isEqualTo(PatternReader.EOF);
        assertThat(reader.position()).isEqualTo(1);
    }
}
