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

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Character build. Tasks whose bonus stat matches the primary stat earn the
 * class affinity bonus.
 */
@Getter
@RequiredArgsConstructor
public enum CharacterClass {
    WARRIOR(StatType.STRENGTH, null),
    MAGE(StatType.WISDOM, null),
    ARCHER(StatType.DEXTERITY, null),
    BERSERKER(StatType.STRENGTH, WARRIOR),
    PALADIN(StatType.DEXTERITY, WARRIOR),
    SORCERER(StatType.WISDOM, MAGE),
    ENCHANTER(StatType.CHARISMA, MAGE),
    RANGER(StatType.DEXTERITY, ARCHER),
    TRICKSTER(StatType.LUCK, ARCHER);

    private final StatType primaryStat;
    private final CharacterClass evolvedFrom;

    public boolean isStarter() {
        return evolvedFrom == null;
    }

    public boolean hasAffinityFor(TaskCategory category) {
        return category != null && category.getBonusStat() == primaryStat;
    }
}
