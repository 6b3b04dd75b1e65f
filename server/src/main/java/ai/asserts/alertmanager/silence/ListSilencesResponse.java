/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class ListSilencesResponse {
    private final List<SilenceResponse> silences;
    private final int total;
    private final int limit;
    private final int offset;
}
