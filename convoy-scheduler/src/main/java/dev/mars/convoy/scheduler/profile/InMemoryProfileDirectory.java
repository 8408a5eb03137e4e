/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.convoy.scheduler.profile;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Profile directory backed by a concurrent map. Profiles are usually synced in
 * from the application that owns them.
 */
public class InMemoryProfileDirectory implements ProfileDirectory {

    private final ConcurrentHashMap<String, Profile> profiles = new ConcurrentHashMap<>();

    public InMemoryProfileDirectory() {
    }

    public InMemoryProfileDirectory(Collection<Profile> initial) {
        initial.forEach(this::put);
    }

    public void put(Profile profile) {
        Objects.requireNonNull(profile, "Profile cannot be null");
        profiles.put(profile.id(), profile);
    }

    public boolean remove(String profileId) {
        return profiles.remove(profileId) != null;
    }

    @Override
    public Optional<Profile> find(String profileId) {
        return profileId != null ? Optional.ofNullable(profiles.get(profileId)) : Optional.empty();
    }

    public List<Profile> list() {
        return List.copyOf(profiles.values());
    }
}
