package com.foliotrack.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "portfolios")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Portfolio {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String userId;
    private String name;
    private String description;
    private Instant createdAt;
}
