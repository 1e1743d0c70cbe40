package com.ueep.core.api;

import com.ueep.core.api.dto.DataResponse;
import com.ueep.core.common.NodeIdentity;
import com.ueep.core.config.DataProperties;
import com.ueep.core.data.FetchResult;
import com.ueep.core.data.ResilientDataAccessor;
import java.time.Clock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/data")
public class DataController {
    private final ResilientDataAccessor dataAccessor;
    private final DataProperties properties;
    private final NodeIdentity nodeIdentity;
    private final Clock clock;

    public DataController(
        ResilientDataAccessor dataAccessor,
        DataProperties properties,
        NodeIdentity nodeIdentity,
        Clock clock
    ) {
        this.dataAccessor = dataAccessor;
        this.properties = properties;
        this.nodeIdentity = nodeIdentity;
        this.clock = clock;
    }

    @GetMapping
    public DataResponse fetchDefault() {
        return fetch(properties.getDefaultKey());
    }

    @GetMapping("/{key}")
    public DataResponse fetch(@PathVariable("key") String key) {
        FetchResult result = dataAccessor.fetch(key);
        DataResponse response = new DataResponse();
        response.setKey(result.key());
        response.setData(result.value());
        response.setSource(result.source().label());
        response.setNode(nodeIdentity.getHostname());
        response.setTimestamp(clock.instant().toString());
        return response;
    }
}
