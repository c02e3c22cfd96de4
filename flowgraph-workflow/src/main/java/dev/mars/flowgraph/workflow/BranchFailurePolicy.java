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

package dev.mars.flowgraph.workflow;

/**
 * What a JOIN does when one of the branches it waits for ended FAILED.
 * Only optional nodes can leave a branch failed without failing the whole run.
 */
public enum BranchFailurePolicy {
    FAIL_FAST,
    TOLERATE_PARTIAL;

    public static BranchFailurePolicy fromName(String name) {
        if (name == null) {
            return null;
        }
        for (BranchFailurePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name.trim())) {
                return policy;
            }
        }
        return null;
    }
}
