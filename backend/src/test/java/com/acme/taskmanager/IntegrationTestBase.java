package com.acme.taskmanager;

import com.acme.taskmanager.domain.repo.TaskRepository;
import com.acme.taskmanager.support.FakeRedis;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(IntegrationTestBase.FakeRedisConfig.class)
public abstract class IntegrationTestBase {
    @Autowired
    protected MockMvc mvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected FakeRedis fakeRedis;

    @Autowired
    protected TaskRepository taskRepository;

    @BeforeEach
    void resetState() {
        taskRepository.deleteAll();
        fakeRedis.clear();
    }

    protected long createTask(String json) throws Exception {
        var created = mvc.perform(post("/api/tasks").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isCreated())
                .andReturn();
        return readJson(created.getResponse().getContentAsString()).get("id").asLong();
    }

    protected JsonNode readJson(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    @TestConfiguration
    static class FakeRedisConfig {
        @Bean
        FakeRedis fakeRedis() {
            return new FakeRedis();
        }

        @Bean
        @Primary
        StringRedisTemplate fakeStringRedisTemplate(FakeRedis fakeRedis) {
            return fakeRedis.template();
        }
    }
}
