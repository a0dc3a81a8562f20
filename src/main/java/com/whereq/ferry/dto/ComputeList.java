package com.whereq.ferry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a Compute Engine list call
 *
 * @param <T> item type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComputeList<T> {

    private List<T> items;

    private String nextPageToken;
}
