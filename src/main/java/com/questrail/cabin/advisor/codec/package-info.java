/**
 * JSON codec for the advisor's two bus topics.
 *
 * <pre>
 *   vehicle/actions         bytes -> ActionEventDecoder -> ActionEvent
 *   vehicle/recommendations List&lt;Recommendation&gt; -> RecommendationEnvelopeEncoder -> bytes
 * </pre>
 *
 * <p>The codec knows nothing about the transport or the session. Decode
 * failures surface as {@link com.questrail.cabin.advisor.codec.ActionDecodeException}
 * and are contained by the bus runtime.</p>
 */
package com.questrail.cabin.advisor.codec;
