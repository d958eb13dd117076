/*
 * (C) Copyright 2024 ProctorAI (https://proctorai.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.proctorai.room.api.pojo;

public final class UploadResult {
  private final String url;
  private final String objectKey;

  public UploadResult(String url, String objectKey) {
    this.url = url;
    this.objectKey = objectKey;
  }

  public String getUrl() {
    return url;
  }

  public String getObjectKey() {
    return objectKey;
  }

  @Override
  public String toString() {
    return "UploadResult{url='" + url + "', objectKey='" + objectKey + "'}";
  }
}
