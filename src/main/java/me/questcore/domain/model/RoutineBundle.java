package me.questcore.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A named group of habits that pays a bonus once every habit in it has been
 * completed on the same day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutineBundle {

    public static final int MIN_HABITS = 3;
    public static final int MAX_HABITS = 6;

    private String id;
    private String ownerId;
    private String name;

    @Builder.Default
    private List<String> habitSeriesIds = new ArrayList<>();

    @Builder.Default
    private boolean active = true;
    private Instant createdAt;
}
