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

package dev.mars.sequor.workflow.cache;

import dev.mars.sequor.core.SimpleWorkflowContext;
import dev.mars.sequor.core.StepMetadata;
import dev.mars.sequor.core.StepOutput;
import dev.mars.sequor.core.StepType;
import dev.mars.sequor.core.Workflow;
import dev.mars.sequor.workflow.TestWorkflows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CacheKeyGenerator")
class CacheKeyGeneratorTest {

    private final CacheKeyGenerator generator = new CacheKeyGenerator();

    /**
     * Has no bean properties, so Jackson refuses to write it.
     */
    private static final class Handle {
        private final String target;

        Handle(String target) {
            this.target = target;
        }

        @Override
        public String toString() {
            return "Handle[" + target + "]";
        }
    }

    private static Workflow withHandle(String name, Object handle) {
        return TestWorkflows.workflow(name, TestWorkflows.step(StepMetadata.builder()
                .name("connect")
                .type(StepType.SETUP)
                .parameter("handle", handle)
                .build(), context -> StepOutput.success(Map.of())));
    }

    @Test
    @DisplayName("Map order does not change the fingerprint")
    void orderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("projectId", "p-1");
        first.put("environment", "test");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("environment", "test");
        second.put("projectId", "p-1");

        assertThat(generator.hashContext(SimpleWorkflowContext.of(first)))
                .isEqualTo(generator.hashContext(SimpleWorkflowContext.of(second)));
    }

    @Test
    @DisplayName("Workflows with unserializable parameters still get distinct keys")
    void unserializableParametersKeepWorkflowsApart() {
        Handle handle = new Handle("db");

        String deploy = generator.hashWorkflow(withHandle("deploy-prod", handle));
        String analyse = generator.hashWorkflow(withHandle("analyse-lib", handle));

        assertThat(deploy).isNotEqualTo(analyse).hasSize(32);
        assertThat(generator.hashWorkflow(withHandle("deploy-prod", handle))).isEqualTo(deploy);
    }

    @Test
    @DisplayName("Unserializable context values take part in the fingerprint")
    void unserializableContextValues() {
        String first = generator.hashContext(SimpleWorkflowContext.of(Map.of("config", new Handle("a"))));
        String second = generator.hashContext(SimpleWorkflowContext.of(Map.of("config", new Handle("b"))));

        assertThat(first).isNotEqualTo(second);
        assertThat(generator.hashContext(SimpleWorkflowContext.of(Map.of("config", new Handle("a")))))
                .isEqualTo(first);
    }

    @Test
    @DisplayName("The text rendering sorts map keys and keeps collection order")
    void canonicalText() {
        StringBuilder text = new StringBuilder();
        CacheKeyGenerator.appendCanonical(text, Map.of("b", List.of(1, 2), "a", "x"));

        assertThat(text.toString())
                .isEqualTo("{a=java.lang.String:x;b=[java.lang.Integer:1;java.lang.Integer:2;];}");
    }
}
