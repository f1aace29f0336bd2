package org.github.zzf.realtime.publisher;

import com.alibaba.fastjson.JSONObject;
import lombok.Value;

/**
 * one location report of a delivery partner
 */
@Value
public class Position {

    double lat;
    double lng;
    String partnerId;
    long timestamp;

    JSONObject toJson() {
        JSONObject location = new JSONObject(true);
        location.put("lat", lat);
        location.put("lng", lng);
        return location;
    }

}
