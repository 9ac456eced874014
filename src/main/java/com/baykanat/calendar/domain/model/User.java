package com.baykanat.calendar.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** users tablosu satırı; parola yalnızca hash olarak tutulur. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private Long id;
    private String username;
    @ToString.Exclude
    private String passwordHash;
}
