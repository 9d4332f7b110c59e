package dev.vacancypoller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Response of {@code GET /resumes/mine}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResumeList {

    private int found;
    private List<Resume> items = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Resume {
        private String id;
        private Integer age;

        @JsonProperty("first_name")
        private String firstName;

        @JsonProperty("last_name")
        private String lastName;
    }
}
