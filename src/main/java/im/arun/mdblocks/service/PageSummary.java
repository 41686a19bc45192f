package im.arun.mdblocks.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageSummary {
    private String name;
    private boolean journal;
}
