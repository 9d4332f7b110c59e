package dev.vacancypoller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Page returned by {@code GET /resumes/{id}/similar_vacancies}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VacancySearchResult {

    private int found;
    private List<Item> items = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private String id;
        private String name;
        private String url;

        @JsonProperty("alternate_url")
        private String alternateUrl;

        @JsonProperty("published_at")
        private String publishedAt;

        // Both may be null on the wire
        private Salary salary;
        private Contacts contacts;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Salary {
        private String currency;
        private Integer from;
        private Integer to;
        private Boolean gross;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Contacts {
        private String email;
        private String name;
        private List<Phone> phones;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Phone {
        private String number;
        private String country;
        private String city;
        private String comment;
    }
}
